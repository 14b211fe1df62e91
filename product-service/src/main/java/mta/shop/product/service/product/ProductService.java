package mta.shop.product.service.product;

import mta.shop.product.exception.InsufficientStockException;
import mta.shop.product.exception.InvalidImageException;
import mta.shop.product.exception.ProductNotFoundException;
import mta.shop.product.exception.StockLimitExceededException;
import mta.shop.product.model.product.Product;
import mta.shop.product.model.request.CreateProductRequest;
import mta.shop.product.model.request.UpdateProductRequest;
import mta.shop.product.repository.ProductRepository;
import mta.shop.product.service.storage.BlobStorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * ProductService
 * Business logic for the product catalogue: CRUD, stock movements and images.
 */
@Service
public class ProductService {

    private static final Logger logger = LoggerFactory.getLogger(ProductService.class);

    private final ProductRepository productRepository;
    private final BlobStorageService blobStorageService;
    private final Clock clock;

    @Autowired
    public ProductService(ProductRepository productRepository, BlobStorageService blobStorageService) {
        this(productRepository, blobStorageService, Clock.systemUTC());
    }

    ProductService(ProductRepository productRepository, BlobStorageService blobStorageService, Clock clock) {
        this.productRepository = productRepository;
        this.blobStorageService = blobStorageService;
        this.clock = clock;
    }

    public Product createProduct(CreateProductRequest request) {
        Instant now = clock.instant();
        Product product = new Product(
                null,
                request.name().trim(),
                request.description(),
                request.price().setScale(2, RoundingMode.HALF_UP),
                request.stockQuantity(),
                request.imageUrl(),
                now,
                now
        );
        Product saved = productRepository.insert(product);
        logger.info("Created product id={} name='{}' price={} stock={}",
                saved.productId(), saved.name(), saved.price(), saved.stockQuantity());
        return saved;
    }

    public List<Product> listProducts(int skip, int limit, String search) {
        List<Product> products = productRepository.findAll(skip, limit, search);
        logger.debug("Listed {} products (skip={}, limit={}, search='{}')", products.size(), skip, limit, search);
        return products;
    }

    public Product getProduct(long productId) {
        return productRepository.findById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));
    }

    /**
     * Applies the non-null fields of the request to the stored product.
     * Only those columns are written, so stock moved concurrently is kept.
     */
    @Transactional
    public Product updateProduct(long productId, UpdateProductRequest request) {
        BigDecimal price = request.price() != null
                ? request.price().setScale(2, RoundingMode.HALF_UP)
                : null;

        boolean updated = productRepository.update(
                productId,
                request.name() != null ? request.name().trim() : null,
                request.description(),
                price,
                request.stockQuantity(),
                request.imageUrl(),
                clock.instant());
        if (!updated) {
            throw new ProductNotFoundException(productId);
        }
        logger.info("Updated product id={}", productId);
        return getProduct(productId);
    }

    public void deleteProduct(long productId) {
        if (!productRepository.deleteById(productId)) {
            throw new ProductNotFoundException(productId);
        }
        logger.info("Deleted product id={}", productId);
    }

    /**
     * Removes quantity units from stock in a single conditional update.
     *
     * @throws ProductNotFoundException if the product does not exist
     * @throws InsufficientStockException if fewer than quantity units are left
     */
    @Transactional
    public Product deductStock(long productId, int quantity) {
        if (!productRepository.deductStock(productId, quantity, clock.instant())) {
            Product current = getProduct(productId);
            throw new InsufficientStockException(productId, current.stockQuantity(), quantity);
        }
        Product product = getProduct(productId);
        logger.info("Deducted {} from product id={}, remaining stock={}", quantity, productId, product.stockQuantity());
        return product;
    }

    /**
     * Adds quantity units to stock.
     *
     * @throws ProductNotFoundException if the product does not exist
     * @throws StockLimitExceededException if the new stock would not fit an INTEGER
     */
    @Transactional
    public Product restock(long productId, int quantity) {
        if (!productRepository.addStock(productId, quantity, clock.instant())) {
            Product current = getProduct(productId);
            throw new StockLimitExceededException(productId, current.stockQuantity(), quantity);
        }
        Product product = getProduct(productId);
        logger.info("Restocked {} to product id={}, stock now={}", quantity, productId, product.stockQuantity());
        return product;
    }

    /**
     * Stores an image for the product and points image_url at its SAS URL.
     *
     * @throws InvalidImageException if the file is empty or not an image
     */
    public Product uploadImage(long productId, String originalFilename, String contentType, byte[] content) {
        if (content == null || content.length == 0) {
            throw new InvalidImageException("Uploaded file is empty");
        }
        if (contentType == null || !contentType.toLowerCase(Locale.ROOT).startsWith("image/")) {
            throw new InvalidImageException("Only image files are allowed, got content type '" + contentType + "'");
        }

        Product product = getProduct(productId);
        String blobName = "product-" + productId + "-" + UUID.randomUUID() + extensionOf(originalFilename);
        String imageUrl = blobStorageService.upload(blobName, content, contentType);

        Instant now = clock.instant();
        if (!productRepository.updateImageUrl(productId, imageUrl, now)) {
            // Product deleted while the upload ran
            discardBlob(blobName, productId);
            throw new ProductNotFoundException(productId);
        }
        logger.info("Stored image '{}' for product id={}", blobName, productId);
        return new Product(product.productId(), product.name(), product.description(), product.price(),
                product.stockQuantity(), imageUrl, product.createdAt(), now);
    }

    private void discardBlob(String blobName, long productId) {
        try {
            blobStorageService.delete(blobName);
            logger.info("Deleted blob '{}' of removed product id={}", blobName, productId);
        } catch (RuntimeException e) {
            logger.warn("Orphan blob '{}' left for removed product id={}: {}", blobName, productId, e.getMessage());
        }
    }

    static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return "";
        }
        String extension = filename.substring(dot + 1).toLowerCase(Locale.ROOT);
        return extension.matches("[a-z0-9]{1,10}") ? "." + extension : "";
    }
}

package com.RetailCore.pos_backend.service;

import com.RetailCore.pos_backend.config.InventoryProperties;
import com.RetailCore.pos_backend.dto.request.BulkCategoryUpdateRequest;
import com.RetailCore.pos_backend.dto.request.ProductRequest;
import com.RetailCore.pos_backend.dto.response.OperationResult;
import com.RetailCore.pos_backend.dto.response.ProductResponse;
import com.RetailCore.pos_backend.enums.ErrorType;
import com.RetailCore.pos_backend.enums.PriceType;
import com.RetailCore.pos_backend.exception.ResourceNotFoundException;
import com.RetailCore.pos_backend.exception.ValidationException;
import com.RetailCore.pos_backend.exception.WorkspaceAccessException;
import com.RetailCore.pos_backend.model.PriceHistoryEntry;
import com.RetailCore.pos_backend.model.Product;
import com.RetailCore.pos_backend.model.ProductVariant;
import com.RetailCore.pos_backend.repository.ProductRepository;
import com.RetailCore.pos_backend.security.Actor;
import com.RetailCore.pos_backend.security.WorkspaceContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class ProductService {

    private final ProductRepository productRepository;
    private final WorkspaceContext workspaceContext;
    private final InventoryProperties inventoryProperties;
    private final ModelMapper modelMapper;

    @Transactional(readOnly = true)
    public List<ProductResponse> getProducts() {
        return productRepository.findByWorkspaceIdOrderByNameAsc(workspaceContext.getWorkspaceId())
                .stream()
                .map(this::mapToResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public ProductResponse getProduct(UUID id) {
        return mapToResponse(findOwnedProduct(id));
    }

    @Transactional
    public ProductResponse addProduct(ProductRequest request) {
        String workspaceId = workspaceContext.getWorkspaceId();
        if (productRepository.existsByWorkspaceIdAndSku(workspaceId, request.getSku())) {
            throw new ValidationException("Product with SKU '" + request.getSku() + "' already exists");
        }

        Product product = buildProduct(workspaceId, request, 0);
        Product saved = productRepository.save(product);

        log.info("Product created: {} ({})", saved.getName(), saved.getSku());
        return mapToResponse(saved);
    }

    /**
     * Updates product details. Price changes are appended to the price history of the
     * product and of each variant. Stock cannot be changed here.
     */
    @Transactional
    public ProductResponse updateProduct(UUID id, ProductRequest request) {
        Product product = findOwnedProduct(id);

        if (request.getSku() != null && !request.getSku().equals(product.getSku())) {
            if (productRepository.existsByWorkspaceIdAndSku(product.getWorkspaceId(), request.getSku())) {
                throw new ValidationException("Product with SKU '" + request.getSku() + "' already exists");
            }
            product.setSku(request.getSku());
        }

        Actor actor = workspaceContext.getCurrentActor();
        LocalDateTime now = LocalDateTime.now();

        recordPriceChange(product.getPriceHistory(), PriceType.RETAIL, product.getRetailPrice(), request.getRetailPrice(), actor, now);
        recordPriceChange(product.getPriceHistory(), PriceType.COST, product.getCostPrice(), request.getCostPrice(), actor, now);

        if (request.getName() != null) {
            product.setName(request.getName());
        }
        if (request.getRetailPrice() != null) {
            product.setRetailPrice(request.getRetailPrice());
        }
        if (request.getCostPrice() != null) {
            product.setCostPrice(request.getCostPrice());
        }
        if (request.getLowStockThreshold() != null) {
            product.setLowStockThreshold(request.getLowStockThreshold());
        }
        if (request.getCategoryIds() != null) {
            product.setCategoryIds(new ArrayList<>(new LinkedHashSet<>(request.getCategoryIds())));
        }

        if (request.getVariants() != null) {
            for (ProductRequest.VariantRequest variantRequest : request.getVariants()) {
                ProductVariant existing = variantRequest.getId() == null
                        ? null
                        : product.findVariant(variantRequest.getId()).orElse(null);

                if (existing == null) {
                    // New variants start empty, their stock arrives through the ledger
                    ProductVariant variant = buildVariant(variantRequest, 0);
                    product.addVariant(variant);
                    log.debug("Variant {} added to product {}", variant.getLabel(), product.getName());
                    continue;
                }

                recordPriceChange(existing.getPriceHistory(), PriceType.RETAIL, existing.getRetailPrice(),
                        variantRequest.getRetailPrice(), actor, now);
                recordPriceChange(existing.getPriceHistory(), PriceType.COST, existing.getCostPrice(),
                        variantRequest.getCostPrice(), actor, now);

                if (variantRequest.getSku() != null) {
                    existing.setSku(variantRequest.getSku());
                }
                if (variantRequest.getOptions() != null && !variantRequest.getOptions().isEmpty()) {
                    existing.setOptions(new LinkedHashMap<>(variantRequest.getOptions()));
                }
                if (variantRequest.getRetailPrice() != null) {
                    existing.setRetailPrice(variantRequest.getRetailPrice());
                }
                if (variantRequest.getCostPrice() != null) {
                    existing.setCostPrice(variantRequest.getCostPrice());
                }
            }
        }

        product.recalculateStock();
        Product saved = productRepository.save(product);

        log.info("Product updated: {}", saved.getName());
        return mapToResponse(saved);
    }

    /**
     * Creates already-parsed products in bulk. Products whose SKU exists, or repeats
     * within the batch, are skipped.
     */
    @Transactional
    public OperationResult<Integer> importProducts(List<ProductRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            return OperationResult.failure(ErrorType.VALIDATION_ERROR, "No products to import.");
        }

        String workspaceId = workspaceContext.getWorkspaceId();
        Set<String> requestedSkus = requests.stream()
                .map(ProductRequest::getSku)
                .collect(Collectors.toSet());
        Set<String> takenSkus = productRepository.findByWorkspaceIdAndSkuIn(workspaceId, requestedSkus)
                .stream()
                .map(Product::getSku)
                .collect(Collectors.toCollection(HashSet::new));

        List<Product> toSave = new ArrayList<>();
        for (ProductRequest request : requests) {
            if (request.getSku() == null || request.getSku().isBlank() || !takenSkus.add(request.getSku())) {
                log.debug("Import skipped duplicate SKU {}", request.getSku());
                continue;
            }
            int stock = request.getStock() != null ? Math.max(0, request.getStock()) : 0;
            toSave.add(buildProduct(workspaceId, request, stock));
        }

        if (toSave.isEmpty()) {
            return OperationResult.failure(ErrorType.VALIDATION_ERROR,
                    "No new products were imported. All SKUs already exist.");
        }

        productRepository.saveAll(toSave);
        int skipped = requests.size() - toSave.size();

        log.info("Imported {} products ({} skipped) into workspace {}", toSave.size(), skipped, workspaceId);
        return OperationResult.ok(toSave.size(), "Imported " + toSave.size() + " products"
                + (skipped > 0 ? ", skipped " + skipped + " duplicates." : "."));
    }

    @Transactional
    public OperationResult<Integer> bulkUpdateProductCategories(BulkCategoryUpdateRequest request) {
        String workspaceId = workspaceContext.getWorkspaceId();
        List<Product> products = productRepository.findByWorkspaceIdAndIdIn(workspaceId, request.getProductIds());

        if (products.isEmpty()) {
            return OperationResult.failure(ErrorType.NOT_FOUND, "None of the selected products were found.");
        }

        for (Product product : products) {
            Set<UUID> categories = new LinkedHashSet<>(product.getCategoryIds());
            switch (request.getAction()) {
                case ADD:
                    categories.addAll(request.getCategoryIds());
                    break;
                case REPLACE:
                    categories = new LinkedHashSet<>(request.getCategoryIds());
                    break;
                case REMOVE:
                    request.getCategoryIds().forEach(categories::remove);
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported category action: " + request.getAction());
            }
            product.setCategoryIds(new ArrayList<>(categories));
        }

        productRepository.saveAll(products);

        log.info("Categories {} on {} products", request.getAction(), products.size());
        return OperationResult.ok(products.size(), "Updated categories for " + products.size() + " products.");
    }

    Product findOwnedProduct(UUID id) {
        Product product = productRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Product", "id", id));
        if (!workspaceContext.owns(product.getWorkspaceId())) {
            throw new WorkspaceAccessException("product");
        }
        return product;
    }

    ProductResponse mapToResponse(Product product) {
        return modelMapper.map(product, ProductResponse.class);
    }

    private Product buildProduct(String workspaceId, ProductRequest request, int stock) {
        Product product = Product.builder()
                .id(UUID.randomUUID())
                .workspaceId(workspaceId)
                .sku(request.getSku())
                .name(request.getName())
                .retailPrice(orZero(request.getRetailPrice()))
                .costPrice(orZero(request.getCostPrice()))
                .stock(stock)
                .lowStockThreshold(request.getLowStockThreshold() != null
                        ? request.getLowStockThreshold()
                        : inventoryProperties.getDefaultLowStockThreshold())
                .categoryIds(request.getCategoryIds() != null
                        ? new ArrayList<>(new LinkedHashSet<>(request.getCategoryIds()))
                        : new ArrayList<>())
                .build();

        if (request.getVariants() != null) {
            request.getVariants().forEach(v -> product.addVariant(buildVariant(v, Math.max(0, v.getStock()))));
        }
        product.recalculateStock();
        return product;
    }

    private ProductVariant buildVariant(ProductRequest.VariantRequest request, int stock) {
        return ProductVariant.builder()
                .id(UUID.randomUUID())
                .sku(request.getSku())
                .options(request.getOptions() != null ? new LinkedHashMap<>(request.getOptions()) : new LinkedHashMap<>())
                .stock(stock)
                .costPrice(orZero(request.getCostPrice()))
                .retailPrice(orZero(request.getRetailPrice()))
                .build();
    }

    private void recordPriceChange(List<PriceHistoryEntry> history, PriceType priceType,
                                   BigDecimal oldValue, BigDecimal newValue, Actor actor, LocalDateTime changedAt) {
        if (newValue == null || (oldValue != null && oldValue.compareTo(newValue) == 0)) {
            return;
        }
        history.add(PriceHistoryEntry.builder()
                .changedAt(changedAt)
                .priceType(priceType)
                .oldValue(oldValue)
                .newValue(newValue)
                .actorId(actor.getId())
                .actorName(actor.getName())
                .build());
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}

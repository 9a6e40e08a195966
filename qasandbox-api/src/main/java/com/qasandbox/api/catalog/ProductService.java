package com.qasandbox.api.catalog;

import com.qasandbox.api.common.OffsetPageRequest;
import com.qasandbox.domain.NotFoundException;
import com.qasandbox.domain.access.AccessPolicy;
import com.qasandbox.domain.access.Action;
import com.qasandbox.domain.access.Principal;
import com.qasandbox.domain.access.ResourceType;
import com.qasandbox.infrastructure.catalog.CategoryEntity;
import com.qasandbox.infrastructure.catalog.CategoryRepository;
import com.qasandbox.infrastructure.catalog.ProductEntity;
import com.qasandbox.infrastructure.catalog.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Service
public class ProductService {

  private static final Logger log = LoggerFactory.getLogger(ProductService.class);

  private static final Set<String> SORTABLE = Set.of("price", "name", "createdAt", "stock");

  private final ProductRepository products;
  private final CategoryRepository categories;
  private final AccessPolicy accessPolicy;

  public ProductService(ProductRepository products, CategoryRepository categories, AccessPolicy accessPolicy) {
    this.products = products;
    this.categories = categories;
    this.accessPolicy = accessPolicy;
  }

  public record ProductQuery(
      Boolean isActive,
      Long categoryId,
      BigDecimal minPrice,
      BigDecimal maxPrice,
      Boolean inStock,
      String search,
      String sortBy,
      String sortOrder
  ) {}

  public record ProductDraft(
      String name,
      String description,
      BigDecimal price,
      Integer stock,
      String sku,
      Long categoryId
  ) {}

  /** Partial update; {@code clearCategory} detaches the product from its category. */
  public record ProductUpdate(
      String name,
      String description,
      BigDecimal price,
      Integer stock,
      String sku,
      Long categoryId,
      boolean clearCategory,
      Boolean isActive
  ) {}

  @Transactional(readOnly = true)
  public List<ProductView> list(Principal principal, ProductQuery query, int skip, int limit) {
    accessPolicy.require(principal, Action.READ, ResourceType.PRODUCT);

    Specification<ProductEntity> spec = Specification.where(null);
    if (query.isActive() != null) {
      spec = spec.and((root, q, cb) -> cb.equal(root.get("active"), query.isActive()));
    }
    if (query.categoryId() != null) {
      spec = spec.and((root, q, cb) -> cb.equal(root.get("categoryId"), query.categoryId()));
    }
    if (query.minPrice() != null) {
      spec = spec.and((root, q, cb) -> cb.greaterThanOrEqualTo(root.get("price"), query.minPrice()));
    }
    if (query.maxPrice() != null) {
      spec = spec.and((root, q, cb) -> cb.lessThanOrEqualTo(root.get("price"), query.maxPrice()));
    }
    if (query.inStock() != null) {
      spec = spec.and((root, q, cb) -> query.inStock()
          ? cb.greaterThan(root.get("stock"), 0)
          : cb.equal(root.get("stock"), 0));
    }
    if (query.search() != null && !query.search().isBlank()) {
      String pattern = "%" + query.search().trim().toLowerCase(Locale.ROOT) + "%";
      spec = spec.and((root, q, cb) -> cb.or(
          cb.like(cb.lower(root.get("name")), pattern),
          cb.like(cb.lower(root.get("description")), pattern),
          cb.like(cb.lower(root.get("sku")), pattern)
      ));
    }

    List<ProductEntity> page = products.findAll(spec, OffsetPageRequest.of(skip, limit, sort(query))).getContent();
    return withCategories(page);
  }

  @Transactional(readOnly = true)
  public ProductView get(Principal principal, long id) {
    accessPolicy.require(principal, Action.READ, ResourceType.PRODUCT);
    return withCategories(List.of(load(id))).get(0);
  }

  /**
   * @throws IllegalArgumentException on a duplicate sku or an unknown category
   */
  @Transactional
  public ProductView create(Principal principal, ProductDraft draft) {
    accessPolicy.require(principal, Action.CREATE, ResourceType.PRODUCT);
    String sku = draft.sku().trim();
    if (products.findBySku(sku).isPresent()) {
      throw new IllegalArgumentException("SKU already exists");
    }
    requireCategory(draft.categoryId());

    ProductEntity saved = products.save(new ProductEntity(
        draft.name().trim(),
        draft.description(),
        draft.price(),
        draft.stock() == null ? 0 : draft.stock(),
        sku,
        draft.categoryId(),
        Instant.now()
    ));
    log.info("Product created: productId={}, sku={}, by={}", saved.getId(), sku, principal.id());
    return withCategories(List.of(saved)).get(0);
  }

  @Transactional
  public ProductView update(Principal principal, long id, ProductUpdate update) {
    accessPolicy.require(principal, Action.UPDATE, ResourceType.PRODUCT);
    ProductEntity product = load(id);

    if (update.sku() != null) {
      String sku = update.sku().trim();
      products.findBySku(sku)
          .filter(other -> !other.getId().equals(product.getId()))
          .ifPresent(other -> {
            throw new IllegalArgumentException("SKU already exists");
          });
      product.setSku(sku);
    }
    if (update.clearCategory()) {
      product.setCategoryId(null);
    } else if (update.categoryId() != null) {
      requireCategory(update.categoryId());
      product.setCategoryId(update.categoryId());
    }
    if (update.name() != null) product.setName(update.name().trim());
    if (update.description() != null) product.setDescription(update.description());
    if (update.price() != null) product.setPrice(update.price());
    if (update.stock() != null) product.setStock(update.stock());
    if (update.isActive() != null) product.setActive(update.isActive());
    product.setUpdatedAt(Instant.now());

    log.info("Product updated: productId={}, by={}", id, principal.id());
    return withCategories(List.of(product)).get(0);
  }

  @Transactional
  public void delete(Principal principal, long id) {
    accessPolicy.require(principal, Action.DELETE, ResourceType.PRODUCT);
    products.delete(load(id));
    log.info("Product deleted: productId={}, by={}", id, principal.id());
  }

  private ProductEntity load(long id) {
    return products.findById(id).orElseThrow(() -> new NotFoundException(ResourceType.PRODUCT, id));
  }

  private void requireCategory(Long categoryId) {
    if (categoryId != null && !categories.existsById(categoryId)) {
      throw new IllegalArgumentException("Category not found: " + categoryId);
    }
  }

  private List<ProductView> withCategories(List<ProductEntity> page) {
    Set<Long> ids = new HashSet<>();
    for (ProductEntity p : page) {
      if (p.getCategoryId() != null) ids.add(p.getCategoryId());
    }
    Map<Long, CategoryView> byId = new HashMap<>();
    for (CategoryEntity c : categories.findAllById(ids)) {
      byId.put(c.getId(), CategoryView.from(c));
    }
    return page.stream()
        .map(p -> ProductView.from(p, p.getCategoryId() == null ? null : byId.get(p.getCategoryId())))
        .toList();
  }

  private static Sort sort(ProductQuery query) {
    String field = query.sortBy() == null || query.sortBy().isBlank() ? "id" : query.sortBy().trim();
    if (!field.equals("id") && !SORTABLE.contains(field)) {
      throw new IllegalArgumentException("sortBy must be one of " + SORTABLE);
    }
    Sort.Direction direction = "desc".equalsIgnoreCase(query.sortOrder()) ? Sort.Direction.DESC : Sort.Direction.ASC;
    return Sort.by(direction, field).and(Sort.by("id"));
  }
}

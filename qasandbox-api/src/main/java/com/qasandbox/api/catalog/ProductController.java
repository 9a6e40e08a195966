package com.qasandbox.api.catalog;

import com.qasandbox.api.security.PrincipalResolver;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;

@RestController
@RequestMapping("/api/v1/products")
public class ProductController {

  private final ProductService products;
  private final PrincipalResolver principals;

  public ProductController(ProductService products, PrincipalResolver principals) {
    this.products = products;
    this.principals = principals;
  }

  public record CreateProductRequest(
      @NotBlank @Size(max = 200) String name,
      String description,
      @NotNull @DecimalMin(value = "0", inclusive = false) BigDecimal price,
      @Min(0) Integer stock,
      @NotBlank @Size(max = 50) String sku,
      Long categoryId
  ) {}

  public record UpdateProductRequest(
      @Size(min = 1, max = 200) String name,
      String description,
      @DecimalMin(value = "0", inclusive = false) BigDecimal price,
      @Min(0) Integer stock,
      @Size(min = 1, max = 50) String sku,
      Long categoryId,
      Boolean clearCategory,
      Boolean isActive
  ) {}

  @GetMapping
  public List<ProductView> list(
      @AuthenticationPrincipal Jwt jwt,
      @RequestParam(required = false) Boolean isActive,
      @RequestParam(required = false) Long categoryId,
      @RequestParam(required = false) BigDecimal minPrice,
      @RequestParam(required = false) BigDecimal maxPrice,
      @RequestParam(required = false) Boolean inStock,
      @RequestParam(required = false) String search,
      @RequestParam(required = false) String sortBy,
      @RequestParam(defaultValue = "asc") String sortOrder,
      @RequestParam(defaultValue = "0") int skip,
      @RequestParam(defaultValue = "20") int limit
  ) {
    var query = new ProductService.ProductQuery(isActive, categoryId, minPrice, maxPrice, inStock, search, sortBy, sortOrder);
    return products.list(principals.resolve(jwt), query, skip, limit);
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public ProductView create(@AuthenticationPrincipal Jwt jwt, @Valid @RequestBody CreateProductRequest req) {
    var draft = new ProductService.ProductDraft(req.name(), req.description(), req.price(), req.stock(), req.sku(), req.categoryId());
    return products.create(principals.resolve(jwt), draft);
  }

  @GetMapping("/{id}")
  public ProductView get(@AuthenticationPrincipal Jwt jwt, @PathVariable long id) {
    return products.get(principals.resolve(jwt), id);
  }

  @PutMapping("/{id}")
  public ProductView update(@AuthenticationPrincipal Jwt jwt, @PathVariable long id,
                            @Valid @RequestBody UpdateProductRequest req) {
    var update = new ProductService.ProductUpdate(
        req.name(),
        req.description(),
        req.price(),
        req.stock(),
        req.sku(),
        req.categoryId(),
        Boolean.TRUE.equals(req.clearCategory()),
        req.isActive()
    );
    return products.update(principals.resolve(jwt), id, update);
  }

  @DeleteMapping("/{id}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void delete(@AuthenticationPrincipal Jwt jwt, @PathVariable long id) {
    products.delete(principals.resolve(jwt), id);
  }
}

package com.qasandbox.api.catalog;

import com.qasandbox.api.security.PrincipalResolver;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/categories")
public class CategoryController {

  private final CategoryService categories;
  private final PrincipalResolver principals;

  public CategoryController(CategoryService categories, PrincipalResolver principals) {
    this.categories = categories;
    this.principals = principals;
  }

  public record CreateCategoryRequest(
      @NotBlank @Size(max = 100) String name,
      String description
  ) {}

  public record UpdateCategoryRequest(
      @Size(min = 1, max = 100) String name,
      String description,
      Boolean isActive
  ) {}

  @GetMapping
  public List<CategoryView> list(
      @AuthenticationPrincipal Jwt jwt,
      @RequestParam(required = false) Boolean isActive,
      @RequestParam(required = false) String search,
      @RequestParam(defaultValue = "0") int skip,
      @RequestParam(defaultValue = "20") int limit
  ) {
    return categories.list(principals.resolve(jwt), isActive, search, skip, limit).stream()
        .map(CategoryView::from)
        .toList();
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public CategoryView create(@AuthenticationPrincipal Jwt jwt, @Valid @RequestBody CreateCategoryRequest req) {
    return CategoryView.from(categories.create(principals.resolve(jwt), req.name(), req.description()));
  }

  @GetMapping("/{id}")
  public CategoryView get(@AuthenticationPrincipal Jwt jwt, @PathVariable long id) {
    return CategoryView.from(categories.get(principals.resolve(jwt), id));
  }

  @PutMapping("/{id}")
  public CategoryView update(@AuthenticationPrincipal Jwt jwt, @PathVariable long id,
                             @Valid @RequestBody UpdateCategoryRequest req) {
    var update = new CategoryService.CategoryUpdate(req.name(), req.description(), req.isActive());
    return CategoryView.from(categories.update(principals.resolve(jwt), id, update));
  }

  @DeleteMapping("/{id}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void delete(@AuthenticationPrincipal Jwt jwt, @PathVariable long id) {
    categories.delete(principals.resolve(jwt), id);
  }
}

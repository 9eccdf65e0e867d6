package com.codeheadsystems.rental.springboot.controller;

import com.codeheadsystems.rental.model.MessageResponse;
import com.codeheadsystems.rental.model.catalog.CatalogItem;
import com.codeheadsystems.rental.server.manager.CatalogManager;
import com.codeheadsystems.rental.server.store.Page;
import com.codeheadsystems.rental.springboot.security.RentalPrincipal;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Catalog routes. Listing, editing and deleting are scoped to the caller's own items.
 */
@RestController
@RequestMapping("/rental/api/items")
public class CatalogController {

  private final CatalogManager catalogManager;

  public CatalogController(CatalogManager catalogManager) {
    this.catalogManager = catalogManager;
  }

  @GetMapping
  public List<CatalogItem> list(@AuthenticationPrincipal RentalPrincipal principal,
                                @RequestParam(defaultValue = "0") int skip,
                                @RequestParam(defaultValue = "0") int limit) {
    return catalogManager.list(principal.username(), Page.of(skip, limit));
  }

  @GetMapping("/{id}")
  public CatalogItem get(@PathVariable String id) {
    return catalogManager.get(id);
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public CatalogItem add(@AuthenticationPrincipal RentalPrincipal principal, @RequestBody CatalogItem item) {
    return catalogManager.add(principal.username(), item);
  }

  @PutMapping
  public CatalogItem edit(@AuthenticationPrincipal RentalPrincipal principal, @RequestBody CatalogItem item) {
    return catalogManager.edit(principal.username(), item);
  }

  @DeleteMapping("/{id}")
  public MessageResponse delete(@AuthenticationPrincipal RentalPrincipal principal, @PathVariable String id) {
    catalogManager.delete(principal.username(), id);
    return new MessageResponse("Item deleted");
  }
}

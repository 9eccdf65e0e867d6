package com.codeheadsystems.rental.model.catalog;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a rentable catalog item.
 * <p>
 * {@code id}, {@code owner}, {@code date} and {@code version} are assigned by the server;
 * values supplied by clients for those fields are ignored on creation. On edit the client
 * must send the {@code id} and the full body.
 *
 * @param id          server-assigned immutable identifier
 * @param title       display title, unique within the catalog
 * @param releaseDate release date as free-form text
 * @param rentalPrice rental price per period
 * @param rating      rating from 0 to 10
 * @param category    category label
 * @param owner       identity that created the item
 * @param date        last-modified timestamp (ISO-8601, UTC)
 * @param version     incremented by one on every successful edit
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CatalogItem(
    @JsonProperty("_id") String id,
    @JsonProperty("title") String title,
    @JsonProperty("release_date") String releaseDate,
    @JsonProperty("rental_price") double rentalPrice,
    @JsonProperty("rating") int rating,
    @JsonProperty("category") String category,
    @JsonProperty("username") String owner,
    @JsonProperty("date") String date,
    @JsonProperty("version") int version) {
}

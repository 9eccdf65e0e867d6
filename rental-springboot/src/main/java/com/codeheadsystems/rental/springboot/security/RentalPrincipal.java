package com.codeheadsystems.rental.springboot.security;

import java.security.Principal;

/**
 * Authenticated caller of an HTTP request. The raw token is kept so logout can revoke it.
 */
public record RentalPrincipal(String username, String token) implements Principal {

  @Override
  public String getName() {
    return username;
  }
}

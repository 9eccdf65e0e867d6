package com.codeheadsystems.rental.springboot.controller;

import com.codeheadsystems.rental.model.MessageResponse;
import com.codeheadsystems.rental.model.auth.AuthResponse;
import com.codeheadsystems.rental.model.auth.LoginRequest;
import com.codeheadsystems.rental.model.auth.RegisterRequest;
import com.codeheadsystems.rental.server.manager.AuthManager;
import com.codeheadsystems.rental.springboot.security.RentalPrincipal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/rental/api/auth")
public class AuthController {

  private static final Logger log = LoggerFactory.getLogger(AuthController.class);

  private final AuthManager authManager;

  public AuthController(AuthManager authManager) {
    this.authManager = authManager;
  }

  @PostMapping("/register")
  @ResponseStatus(HttpStatus.CREATED)
  public AuthResponse register(@RequestBody RegisterRequest req) {
    log.debug("register()");
    return authManager.register(req.username(), req.password());
  }

  @PostMapping("/login")
  public AuthResponse login(@RequestBody LoginRequest req) {
    log.debug("login()");
    return authManager.login(req.username(), req.password());
  }

  @PostMapping("/logout")
  public MessageResponse logout(@AuthenticationPrincipal RentalPrincipal principal) {
    log.debug("logout({})", principal.username());
    authManager.logout(principal.token(), principal.username());
    return new MessageResponse("logged out");
  }
}

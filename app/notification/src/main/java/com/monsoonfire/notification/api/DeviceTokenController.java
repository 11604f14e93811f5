/*
 * Where: Notification API
 * What: Registers and unregisters push device tokens for the calling user
 * Why: The uid always comes from the authenticated principal, never from the body
 */
package com.monsoonfire.notification.api;

import com.monsoonfire.notification.service.DeviceTokenService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/device-tokens")
@RequiredArgsConstructor
public class DeviceTokenController {

  private final DeviceTokenService deviceTokenService;

  @PostMapping("/register")
  public RegisterResponse register(
      Authentication authentication, @Valid @RequestBody RegisterRequest request) {
    final String tokenHash =
        deviceTokenService.register(
            authentication.getName(),
            new DeviceTokenService.Registration(
                request.token(),
                request.environment(),
                request.appVersion(),
                request.appBuild(),
                request.deviceModel()));
    return new RegisterResponse(tokenHash);
  }

  @PostMapping("/unregister")
  public UnregisterResponse unregister(
      Authentication authentication, @RequestBody UnregisterRequest request) {
    final int deactivated =
        deviceTokenService.unregister(
            authentication.getName(), request.token(), request.tokenHash());
    return new UnregisterResponse(deactivated);
  }

  public record RegisterRequest(
      @NotBlank String token,
      String environment,
      String appVersion,
      String appBuild,
      String deviceModel) {}

  public record RegisterResponse(String tokenHash) {}

  public record UnregisterRequest(String token, String tokenHash) {}

  public record UnregisterResponse(int deactivated) {}
}

/*
 * Where: Notification API
 * What: Device registration, removal and preference endpoints
 * Why: The signed-in user manages the push tokens of their own browsers and phones
 */
package com.worshipteam.notification.api;

import com.worshipteam.notification.service.DeviceRegistryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DeviceController {

  private final DeviceRegistryService deviceRegistryService;

  @PostMapping("/register-device")
  public OkResponse register(
      Authentication authentication, @Valid @RequestBody RegisterDeviceRequest request) {
    deviceRegistryService.registerDevice(
        request.token(),
        authentication.getName(),
        request.role(),
        request.preferences(),
        request.platform());
    return OkResponse.OK;
  }

  @PostMapping("/unregister-device")
  public OkResponse unregister(@Valid @RequestBody UnregisterDeviceRequest request) {
    deviceRegistryService.unregisterDevice(request.token());
    return OkResponse.OK;
  }

  @PostMapping("/update-device-preferences")
  public OkResponse updatePreferences(@Valid @RequestBody UpdateDevicePreferencesRequest request) {
    deviceRegistryService.updatePreferences(
        request.token(), request.preferences(), request.enabled());
    return OkResponse.OK;
  }
}

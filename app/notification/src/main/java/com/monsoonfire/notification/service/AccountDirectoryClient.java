/*
 * Where: Notification service layer
 * What: IdentityDirectory backed by the account service's internal contact endpoint
 * Why: Email, verified phone and staff claims live with the account, not with notifications
 */
package com.monsoonfire.notification.service;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.monsoonfire.notification.config.IdentityClientProperties;
import com.monsoonfire.notification.model.UserContact;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class AccountDirectoryClient implements IdentityDirectory {

  private static final Logger logger = LoggerFactory.getLogger(AccountDirectoryClient.class);

  private final RestClient accountRestClient;
  private final IdentityClientProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring-managed component and cannot be copied")
  public AccountDirectoryClient(RestClient accountRestClient, IdentityClientProperties properties) {
    this.accountRestClient = accountRestClient;
    this.properties = properties;
  }

  @Override
  public Optional<UserContact> findContact(String uid) {
    if (uid == null || uid.isBlank()) {
      throw new IllegalArgumentException("uid is required");
    }
    try {
      final ContactResponse response =
          accountRestClient
              .get()
              .uri(properties.contactPath(), uid)
              .header(properties.internalApiHeaderName(), properties.internalApiToken())
              .retrieve()
              .body(ContactResponse.class);
      if (response == null) {
        throw new IdentityLookupException(
            IdentityLookupException.Reason.INVALID_RESPONSE, "account contact response is empty");
      }
      return Optional.of(response.toContact(uid));
    } catch (RestClientResponseException ex) {
      if (ex.getStatusCode().value() == 404) {
        return Optional.empty();
      }
      logger.warn(
          "account contact lookup failed with http status={} uid={}",
          ex.getStatusCode().value(),
          uid);
      throw new IdentityLookupException(
          IdentityLookupException.Reason.BAD_GATEWAY, "account contact lookup failed", ex);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        logger.warn("account contact lookup timed out uid={}", uid);
        throw new IdentityLookupException(
            IdentityLookupException.Reason.TIMEOUT, "account contact lookup timeout", ex);
      }
      logger.warn("account contact lookup connection failed uid={}", uid, ex);
      throw new IdentityLookupException(
          IdentityLookupException.Reason.BAD_GATEWAY, "account connection failed", ex);
    } catch (IdentityLookupException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("account contact response parse failed uid={}", uid, ex);
      throw new IdentityLookupException(
          IdentityLookupException.Reason.INVALID_RESPONSE, "account contact parse failed", ex);
    }
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  record ContactResponse(
      String userId,
      String email,
      Boolean emailVerified,
      String phoneNumber,
      Boolean staff,
      List<String> roles) {

    UserContact toContact(String requestedUid) {
      final boolean isStaff =
          Boolean.TRUE.equals(staff)
              || (roles != null
                  && roles.stream()
                      .anyMatch(
                          role ->
                              role != null
                                  && ("staff".equals(role.toLowerCase(Locale.ROOT))
                                      || "admin".equals(role.toLowerCase(Locale.ROOT)))));
      return new UserContact(
          userId == null || userId.isBlank() ? requestedUid : userId,
          Boolean.FALSE.equals(emailVerified) ? null : email,
          phoneNumber,
          isStaff);
    }
  }
}

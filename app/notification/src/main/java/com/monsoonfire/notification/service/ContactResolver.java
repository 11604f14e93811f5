/*
 * Where: Notification service layer
 * What: Resolves email, SMS phone number and staff membership for a recipient
 * Why: Directory failures degrade a single channel instead of failing the whole job
 */
package com.monsoonfire.notification.service;

import com.monsoonfire.notification.model.UserContact;
import com.monsoonfire.notification.repository.UserProfileRepository;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ContactResolver {

  private static final Logger logger = LoggerFactory.getLogger(ContactResolver.class);
  private static final Pattern E164 = Pattern.compile("^\\+[1-9]\\d{7,14}$");
  private static final Pattern PHONE_SEPARATORS = Pattern.compile("[\\s()\\-]");

  private final IdentityDirectory identityDirectory;
  private final UserProfileRepository userProfileRepository;

  public Optional<String> resolveEmail(String uid) {
    return lookup(uid)
        .map(UserContact::email)
        .map(String::trim)
        .filter(email -> !email.isEmpty());
  }

  /** Verified identity phone first, then the profile phone fields, normalized to E.164. */
  public Optional<String> resolveSmsPhone(String uid) {
    final Optional<String> identityPhone =
        lookup(uid).map(UserContact::phoneNumber).flatMap(ContactResolver::normalizeE164);
    if (identityPhone.isPresent()) {
      return identityPhone;
    }
    for (String candidate : userProfileRepository.findPhoneCandidates(uid)) {
      final Optional<String> normalized = normalizeE164(candidate);
      if (normalized.isPresent()) {
        return normalized;
      }
    }
    return Optional.empty();
  }

  /** Staff are excluded from member audiences; unknown or unreachable users count as members. */
  public boolean isStaff(String uid) {
    return lookup(uid).map(UserContact::staff).orElse(false);
  }

  static Optional<String> normalizeE164(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String compact = PHONE_SEPARATORS.matcher(raw.trim()).replaceAll("");
    if (compact.startsWith("00")) {
      compact = "+" + compact.substring(2);
    }
    return E164.matcher(compact).matches() ? Optional.of(compact) : Optional.empty();
  }

  private Optional<UserContact> lookup(String uid) {
    try {
      return identityDirectory.findContact(uid);
    } catch (IdentityLookupException ex) {
      logger.warn("identity lookup degraded uid={} reason={}", uid, ex.reason(), ex);
      return Optional.empty();
    }
  }
}

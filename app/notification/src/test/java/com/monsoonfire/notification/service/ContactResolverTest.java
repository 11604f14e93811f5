package com.monsoonfire.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.monsoonfire.notification.model.UserContact;
import com.monsoonfire.notification.repository.UserProfileRepository;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ContactResolverTest {

  @Mock private IdentityDirectory identityDirectory;
  @Mock private UserProfileRepository userProfileRepository;

  private ContactResolver resolver;

  @BeforeEach
  void setUp() {
    resolver = new ContactResolver(identityDirectory, userProfileRepository);
  }

  @Test
  void identityPhoneWinsWhenValid() {
    when(identityDirectory.findContact("user-1"))
        .thenReturn(Optional.of(new UserContact("user-1", null, "+1 (503) 555-0100", false)));

    assertThat(resolver.resolveSmsPhone("user-1")).contains("+15035550100");
    verifyNoInteractions(userProfileRepository);
  }

  @Test
  void fallsBackToFirstValidProfilePhone() {
    when(identityDirectory.findContact("user-1"))
        .thenReturn(Optional.of(new UserContact("user-1", null, "555-0100", false)));
    when(userProfileRepository.findPhoneCandidates("user-1"))
        .thenReturn(List.of("not a phone", "0044 20 7946 0958"));

    assertThat(resolver.resolveSmsPhone("user-1")).contains("+442079460958");
  }

  @Test
  void directoryOutageDegradesToProfilePhone() {
    when(identityDirectory.findContact("user-1"))
        .thenThrow(
            new IdentityLookupException(IdentityLookupException.Reason.TIMEOUT, "timeout"));
    when(userProfileRepository.findPhoneCandidates("user-1")).thenReturn(List.of());

    assertThat(resolver.resolveSmsPhone("user-1")).isEmpty();
  }

  @Test
  void emailIsTrimmedAndBlankIsEmpty() {
    when(identityDirectory.findContact("user-1"))
        .thenReturn(Optional.of(new UserContact("user-1", " a@example.com ", null, false)));
    when(identityDirectory.findContact("user-2"))
        .thenReturn(Optional.of(new UserContact("user-2", "  ", null, false)));

    assertThat(resolver.resolveEmail("user-1")).contains("a@example.com");
    assertThat(resolver.resolveEmail("user-2")).isEmpty();
  }

  @Test
  void unreachableDirectoryCountsAsMember() {
    when(identityDirectory.findContact("user-1"))
        .thenThrow(
            new IdentityLookupException(IdentityLookupException.Reason.BAD_GATEWAY, "down"));

    assertThat(resolver.isStaff("user-1")).isFalse();
  }

  @Test
  void normalizesToE164OrRejects() {
    assertThat(ContactResolver.normalizeE164("+1 503-555-0100")).contains("+15035550100");
    assertThat(ContactResolver.normalizeE164("5035550100")).isEmpty();
    assertThat(ContactResolver.normalizeE164("+0123456789")).isEmpty();
    assertThat(ContactResolver.normalizeE164(null)).isEmpty();
  }
}

package com.monsoonfire.notification.service;

import com.monsoonfire.notification.model.ReservationRouting;
import com.monsoonfire.notification.repository.NotificationPreferencesRepository;
import com.monsoonfire.notification.repository.UserProfileRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/** Combines notification preferences with the reservation opt-in flag. */
@Service
@RequiredArgsConstructor
public class ReservationRoutingService {

  private final NotificationPreferencesRepository preferencesRepository;
  private final UserProfileRepository userProfileRepository;

  public ReservationRouting resolve(String uid) {
    return new ReservationRouting(
        preferencesRepository.findByUid(uid),
        userProfileRepository.isReservationNotificationsEnabled(uid));
  }
}

package com.monsoonfire.notification.repository;

import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** Reservation opt-in flag and profile phone fields maintained by profile management. */
@Repository
@RequiredArgsConstructor
public class UserProfileRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** Defaults to opted in when the profile or the flag is missing. */
  public boolean isReservationNotificationsEnabled(String uid) {
    final String sql = "SELECT notify_reservations FROM user_profiles WHERE uid = :uid";
    final List<Boolean> rows =
        jdbcTemplate.query(
            sql,
            new MapSqlParameterSource("uid", uid),
            (rs, rowNum) -> rs.getObject("notify_reservations", Boolean.class));
    return rows.isEmpty() || rows.get(0) == null || rows.get(0);
  }

  /** Candidate phone numbers in lookup order: E.164 field, phone, mobile phone. */
  public List<String> findPhoneCandidates(String uid) {
    final String sql =
        "SELECT phone_e164, phone, mobile_phone FROM user_profiles WHERE uid = :uid";
    return jdbcTemplate
        .query(
            sql,
            new MapSqlParameterSource("uid", uid),
            (rs, rowNum) -> {
              final List<String> phones = new ArrayList<>();
              for (String column : new String[] {"phone_e164", "phone", "mobile_phone"}) {
                final String value = rs.getString(column);
                if (value != null && !value.isBlank()) {
                  phones.add(value);
                }
              }
              return phones;
            })
        .stream()
        .findFirst()
        .orElse(List.of());
  }
}

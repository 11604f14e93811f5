package com.monsoonfire.notification.service;

import com.monsoonfire.notification.model.UserContact;
import java.util.Optional;

/** Verified contact details and staff claims of a user, by uid. */
public interface IdentityDirectory {

  /**
   * @return empty when the user is unknown
   * @throws IdentityLookupException when the directory cannot answer
   */
  Optional<UserContact> findContact(String uid);
}

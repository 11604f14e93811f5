package com.monsoonfire.notification.model;

/** Contact details and claims resolved from the account directory. */
public record UserContact(String uid, String email, String phoneNumber, boolean staff) {}

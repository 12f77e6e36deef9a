package com.example.pipeline.platform;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class NotificationPreferencesTest {

  private static final NotificationPreferences ALL_OFF =
      new NotificationPreferences(false, false, false, false, false, false, false, false, false);

  @Test
  void transactionalIsAlwaysAllowed() {
    assertThat(ALL_OFF.allows(NotificationCategory.TRANSACTIONAL)).isTrue();
    assertThat(ALL_OFF.wantsEmail(NotificationCategory.TRANSACTIONAL)).isTrue();
  }

  @Test
  void masterSwitchOffBlocksOptionalCategories() {
    final NotificationPreferences prefs =
        new NotificationPreferences(false, true, true, true, true, true, true, true, true);

    assertThat(prefs.allows(NotificationCategory.NEW_EVENTS)).isFalse();
    assertThat(prefs.allows(NotificationCategory.REMINDERS)).isFalse();
  }

  @Test
  void eachCategoryFollowsItsOwnSwitch() {
    final NotificationPreferences prefs =
        new NotificationPreferences(true, false, false, true, false, true, false, true, false);

    assertThat(prefs.allows(NotificationCategory.NEW_EVENTS)).isTrue();
    assertThat(prefs.allows(NotificationCategory.PROGRAMME_CHANGES)).isFalse();
    assertThat(prefs.allows(NotificationCategory.REMINDERS)).isTrue();
    assertThat(prefs.allows(NotificationCategory.COMMENTS)).isFalse();
    assertThat(prefs.allows(NotificationCategory.FAVORITES)).isTrue();
    assertThat(prefs.allows(NotificationCategory.NEWSLETTER)).isFalse();
  }

  @Test
  void newsletterGoesByEmailEvenWithTheEmailSwitchOff() {
    assertThat(ALL_OFF.wantsEmail(NotificationCategory.NEWSLETTER)).isTrue();
    assertThat(ALL_OFF.wantsEmail(NotificationCategory.COMMENTS)).isFalse();
  }

  @Test
  void defaultsEnableEverythingButSms() {
    final NotificationPreferences prefs = NotificationPreferences.allEnabled();

    assertThat(prefs.sms()).isFalse();
    assertThat(prefs.allows(NotificationCategory.NEWSLETTER)).isTrue();
  }
}

package com.rudderstack.sdk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

public class RudderTest {
  private final FakeDeliveryClient fakeClient = new FakeDeliveryClient();
  private final RudderOptions options =
      RudderOptions.builder().dataPlaneUrl("api.example.com").build();

  @AfterEach
  public void tearDown() throws IOException {
    Rudder.shutdown();
  }

  @Test
  public void callsBeforeInitializeFail() {
    assertThat(Rudder.isInitialized()).isFalse();

    final RudderExceptions.NotInitializedError error =
        assertThrows(
            RudderExceptions.NotInitializedError.class,
            () -> Rudder.track(Message.track().event("x").userId("u1").build()));
    assertThat(error.getMessage())
        .isEqualTo("Rudder.initialize() must be called before any other tracking method.");
    assertThrows(
        RudderExceptions.NotInitializedError.class,
        () -> Rudder.identify(Message.identify().userId("u1").build()));
    assertThrows(
        RudderExceptions.NotInitializedError.class,
        () -> Rudder.group(Message.group().groupId("g").userId("u1").build()));
    assertThrows(
        RudderExceptions.NotInitializedError.class,
        () -> Rudder.page(Message.page().userId("u1").build()));
    assertThrows(
        RudderExceptions.NotInitializedError.class,
        () -> Rudder.screen(Message.screen().userId("u1").build()));
    assertThrows(
        RudderExceptions.NotInitializedError.class,
        () -> Rudder.alias(Message.alias().userId("u1").previousId("p").build()));
    assertThrows(RudderExceptions.NotInitializedError.class, Rudder::flush);
  }

  @Test
  public void invalidMessageBeforeInitializeReportsNotInitialized() {
    assertThrows(
        RudderExceptions.NotInitializedError.class, () -> Rudder.track(Message.track().build()));
  }

  @Test
  public void initializeThenTrack() {
    Rudder.initialize("secret", options, configuration -> fakeClient);

    assertThat(Rudder.isInitialized()).isTrue();
    assertThat(Rudder.track(Message.track().event("x").anonymousId("a1").build())).isTrue();
    assertThat(Rudder.flush()).isTrue();
    assertThat(fakeClient.messages).hasSize(1);
  }

  @Test
  public void failedInitializeLeavesNothingInstalled() {
    assertThrows(
        RudderExceptions.ConfigError.class,
        () ->
            Rudder.initialize(
                "secret", RudderOptions.builder().build(), configuration -> fakeClient));

    assertThat(Rudder.isInitialized()).isFalse();
  }

  @Test
  public void secondInitializeFailsAndKeepsFirst() {
    Rudder.initialize("secret", options, configuration -> fakeClient);
    final FakeDeliveryClient secondClient = new FakeDeliveryClient();

    assertThrows(
        RudderExceptions.ConfigError.class,
        () -> Rudder.initialize("other", options, configuration -> secondClient));

    Rudder.page(Message.page().userId("u1").build());
    assertThat(fakeClient.messages).hasSize(1);
    assertThat(secondClient.messages).isEmpty();
  }

  @Test
  public void shutdownAllowsReinitialize() throws IOException {
    Rudder.initialize("secret", options, configuration -> fakeClient);
    Rudder.shutdown();

    assertThat(fakeClient.closed).isTrue();
    assertThat(Rudder.isInitialized()).isFalse();
    assertThrows(RudderExceptions.NotInitializedError.class, Rudder::flush);

    final FakeDeliveryClient secondClient = new FakeDeliveryClient();
    assertDoesNotThrow(() -> Rudder.initialize("secret", options, configuration -> secondClient));
    Rudder.alias(Message.alias().userId("u1").previousId("p1").build());
    assertThat(secondClient.messages).hasSize(1);
  }

  @Test
  public void shutdownWithoutInitializeIsNoop() {
    assertDoesNotThrow(Rudder::shutdown);
  }
}

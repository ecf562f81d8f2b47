package com.rudderstack.sdk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class EventDispatcherTest {
  private final FakeDeliveryClient fakeClient = new FakeDeliveryClient();

  private EventDispatcher dispatcher() {
    return EventDispatcher.builder("secret")
        .options(RudderOptions.builder().dataPlaneUrl("api.example.com").build())
        .deliveryClientFactory(configuration -> fakeClient)
        .build();
  }

  @Test
  public void builderConfiguresEndpoint() {
    final EventDispatcher dispatcher = dispatcher();

    assertThat(dispatcher.getConfiguration().getProtocol()).isEqualTo(Protocol.HTTPS);
    assertThat(dispatcher.getConfiguration().getDataPlaneUrl()).isEqualTo("api.example.com");
  }

  @Test
  public void builderRejectsInvalidConfiguration() {
    assertThrows(
        RudderExceptions.ConfigError.class,
        () ->
            EventDispatcher.builder("secret")
                .options(RudderOptions.builder().build())
                .deliveryClientFactory(configuration -> fakeClient)
                .build());
    assertThrows(
        RudderExceptions.ConfigError.class,
        () ->
            EventDispatcher.builder("")
                .options(RudderOptions.builder().dataPlaneUrl("api.example.com").build())
                .deliveryClientFactory(configuration -> fakeClient)
                .build());
  }

  @Test
  public void factoryReceivesConfiguration() {
    final Configuration[] received = new Configuration[1];
    final EventDispatcher dispatcher =
        EventDispatcher.builder("secret")
            .options(
                RudderOptions.builder()
                    .dataPlaneUrl("http://localhost")
                    .sslEnabled(false)
                    .option("custom", "value")
                    .build())
            .deliveryClientFactory(
                configuration -> {
                  received[0] = configuration;
                  return fakeClient;
                })
            .build();

    assertThat(received[0]).isSameAs(dispatcher.getConfiguration());
    assertThat(received[0].baseUrl()).isEqualTo("http://localhost");
    assertThat(received[0].getOptions()).containsEntry("custom", "value");
  }

  @Test
  public void trackIsDelegated() {
    final EventDispatcher dispatcher = dispatcher();
    final Message.Track track =
        Message.track().event("x").anonymousId("a1").properties(Map.of("plan", "pro")).build();

    assertThat(dispatcher.track(track)).isTrue();
    assertThat(fakeClient.messages).containsExactly(track);
  }

  @Test
  public void delegateResultIsReturnedUnchanged() {
    final EventDispatcher dispatcher = dispatcher();
    fakeClient.result = false;

    assertThat(dispatcher.page(Message.page().userId("u1").build())).isFalse();
    assertThat(dispatcher.flush()).isFalse();
  }

  @Test
  public void trackWithoutAnythingReportsEvent() {
    final EventDispatcher dispatcher = dispatcher();

    final RudderExceptions.ValidationError error =
        assertThrows(
            RudderExceptions.ValidationError.class,
            () -> dispatcher.track(Message.track().build()));

    assertThat(error.getErrorType()).isEqualTo(ErrorType.MISSING_EVENT);
    assertThat(error.getMessage()).contains("event");
    assertThat(fakeClient.messages).isEmpty();
  }

  @Test
  public void missingIdentityIsNotDelegated() {
    final EventDispatcher dispatcher = dispatcher();

    assertThrows(
        RudderExceptions.ValidationError.class,
        () -> dispatcher.screen(Message.screen().name("Home").build()));
    assertThrows(
        RudderExceptions.ValidationError.class,
        () -> dispatcher.group(Message.group().groupId("g1").build()));
    assertThat(fakeClient.messages).isEmpty();
  }

  @Test
  public void aliasRequiresBothIds() {
    final EventDispatcher dispatcher = dispatcher();

    assertThrows(
        RudderExceptions.ValidationError.class,
        () -> dispatcher.alias(Message.alias().userId("u1").build()));
    assertThat(dispatcher.alias(Message.alias().userId("u1").previousId("p1").build())).isTrue();
    assertThat(fakeClient.messages).hasSize(1);
  }

  @Test
  public void identifyIsForwardedAsIdentify() {
    final EventDispatcher dispatcher = dispatcher();

    dispatcher.identify(Message.identify().userId("u1").traits(Map.of("name", "Ada")).build());

    assertThat(fakeClient.messages).hasSize(1);
    final Message forwarded = fakeClient.messages.get(0);
    assertThat(forwarded.type()).isEqualTo(MessageType.IDENTIFY);
    assertThat(forwarded.type().wireName()).isEqualTo("identify");
    assertThat(((Message.Identify) forwarded).traits().get("name")).isEqualTo(Value.of("Ada"));
  }

  @Test
  public void groupIsDelegated() {
    final EventDispatcher dispatcher = dispatcher();

    assertThat(dispatcher.group(Message.group().groupId("g1").userId("u1").build())).isTrue();
    assertThat(fakeClient.messages).hasSize(1);
  }

  @Test
  public void flushIsPassedThrough() {
    final EventDispatcher dispatcher = dispatcher();

    assertThat(dispatcher.flush()).isTrue();
    assertThat(fakeClient.flushCalls).isEqualTo(1);
  }

  @Test
  public void closedDispatcherRaisesNotInitialized() throws IOException {
    final EventDispatcher dispatcher = dispatcher();
    dispatcher.close();
    dispatcher.close();

    assertThat(fakeClient.closed).isTrue();
    assertThrows(RudderExceptions.NotInitializedError.class, dispatcher::flush);
    // initialization is checked before validation
    assertThrows(
        RudderExceptions.NotInitializedError.class,
        () -> dispatcher.track(Message.track().build()));
  }

  @Test
  public void validationFailureNeverReachesDeliveryClient() {
    final DeliveryClient client = mock(DeliveryClient.class);
    final Configuration configuration =
        DataPlaneEndpoint.configure(
            "secret", RudderOptions.builder().dataPlaneUrl("api.example.com").build());
    final EventDispatcher dispatcher = EventDispatcher.create(configuration, c -> client);

    assertThrows(
        RudderExceptions.ValidationError.class,
        () -> dispatcher.alias(Message.alias().previousId("p1").build()));

    verifyNoInteractions(client);
  }

  @Test
  public void screenIsDelegatedToMock() {
    final DeliveryClient client = mock(DeliveryClient.class);
    when(client.screen(any())).thenReturn(true);
    final Configuration configuration =
        DataPlaneEndpoint.configure(
            "secret", RudderOptions.builder().dataPlaneUrl("api.example.com").build());
    final EventDispatcher dispatcher = EventDispatcher.create(configuration, c -> client);
    final Message.Screen screen = Message.screen().anonymousId("a1").name("Home").build();

    assertThat(dispatcher.screen(screen)).isTrue();
    verify(client).screen(screen);
  }

  @Test
  public void closeFailureIsPropagated() throws IOException {
    final DeliveryClient client = mock(DeliveryClient.class);
    doThrow(new IOException("boom")).when(client).close();
    final Configuration configuration =
        DataPlaneEndpoint.configure(
            "secret", RudderOptions.builder().dataPlaneUrl("api.example.com").build());
    final EventDispatcher dispatcher = EventDispatcher.create(configuration, c -> client);

    assertThrows(IOException.class, dispatcher::close);
    assertThrows(RudderExceptions.NotInitializedError.class, dispatcher::flush);
  }
}

package com.rudderstack.sdk;

import com.google.gson.JsonObject;
import java.util.UUID;

/** Builds the data plane JSON form of a message. */
class MessageSerializer {

  static final String LIBRARY = "library";

  private final Clock clock;
  private final JsonObject library;

  MessageSerializer(Clock clock) {
    this(clock, SdkUtils.getSdkVersion());
  }

  MessageSerializer(Clock clock, String sdkVersion) {
    this.clock = clock;
    this.library = new JsonObject();
    library.addProperty("name", SdkUtils.LIBRARY_NAME);
    library.addProperty("version", sdkVersion);
  }

  JsonObject serialize(Message message) {
    final JsonObject json = new JsonObject();
    json.addProperty("type", message.type().wireName());
    json.addProperty(
        "messageId", message.messageId().orElseGet(() -> UUID.randomUUID().toString()));
    json.addProperty(
        "timestamp", message.timestamp().map(Object::toString).orElseGet(clock::isoTimestamp));
    addIfPresent(json, "userId", message.userId());
    addIfPresent(json, "anonymousId", message.anonymousId());

    if (message instanceof Message.Track) {
      addIfPresent(json, "event", ((Message.Track) message).event());
      json.add("properties", message.properties().toJson());
    } else if (message instanceof Message.Identify) {
      json.add("traits", message.properties().toJson());
    } else if (message instanceof Message.Group) {
      addIfPresent(json, "groupId", ((Message.Group) message).groupId());
      json.add("traits", message.properties().toJson());
    } else if (message instanceof Message.Page) {
      final Message.Page page = (Message.Page) message;
      addIfPresent(json, "name", page.name().orElse(null));
      addIfPresent(json, "category", page.category().orElse(null));
      json.add("properties", message.properties().toJson());
    } else if (message instanceof Message.Screen) {
      final Message.Screen screen = (Message.Screen) message;
      addIfPresent(json, "name", screen.name().orElse(null));
      addIfPresent(json, "category", screen.category().orElse(null));
      json.add("properties", message.properties().toJson());
    } else if (message instanceof Message.Alias) {
      addIfPresent(json, "previousId", ((Message.Alias) message).previousId());
    }

    final JsonObject context = message.context().toJson();
    context.add(LIBRARY, library.deepCopy());
    json.add("context", context);
    return json;
  }

  private static void addIfPresent(JsonObject json, String key, String value) {
    if (value != null) {
      json.addProperty(key, value);
    }
  }
}

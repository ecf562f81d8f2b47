package com.rudderstack.sdk;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * An analytics call. Every variant carries the identity of the actor ({@code userId} and/or
 * {@code anonymousId}), a free-form property bag and an optional context; the variants add the
 * fields their call needs.
 *
 * <p>Messages are built with the static factories, e.g.
 *
 * <pre>{@code
 * Message.track().event("Order Completed").userId("u1").properties(Map.of("total", 42)).build();
 * }</pre>
 *
 * <p>Builders never reject missing fields; the rules of each call are enforced by {@link
 * MessageValidator} when the message is dispatched.
 */
public abstract sealed class Message
    permits Message.Track,
        Message.Identify,
        Message.Group,
        Message.Page,
        Message.Screen,
        Message.Alias {

  @Nullable private final String userId;
  @Nullable private final String anonymousId;
  private final Value.Struct properties;
  private final Value.Struct context;
  @Nullable private final Instant timestamp;
  @Nullable private final String messageId;

  private Message(Builder<?, ?> builder) {
    this.userId = builder.userId;
    this.anonymousId = builder.anonymousId;
    this.properties = builder.properties;
    this.context = builder.context;
    this.timestamp = builder.timestamp;
    this.messageId = builder.messageId;
  }

  @Nonnull
  public abstract MessageType type();

  @Nullable
  public String userId() {
    return userId;
  }

  @Nullable
  public String anonymousId() {
    return anonymousId;
  }

  /** Properties of the call; sent as {@code traits} for identify and group. */
  @Nonnull
  public Value.Struct properties() {
    return properties;
  }

  @Nonnull
  public Value.Struct context() {
    return context;
  }

  public Optional<Instant> timestamp() {
    return Optional.ofNullable(timestamp);
  }

  public Optional<String> messageId() {
    return Optional.ofNullable(messageId);
  }

  public static Track.Builder track() {
    return new Track.Builder();
  }

  public static Identify.Builder identify() {
    return new Identify.Builder();
  }

  public static Group.Builder group() {
    return new Group.Builder();
  }

  public static Page.Builder page() {
    return new Page.Builder();
  }

  public static Screen.Builder screen() {
    return new Screen.Builder();
  }

  public static Alias.Builder alias() {
    return new Alias.Builder();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    final Message that = (Message) o;
    return Objects.equals(userId, that.userId)
        && Objects.equals(anonymousId, that.anonymousId)
        && properties.equals(that.properties)
        && context.equals(that.context)
        && Objects.equals(timestamp, that.timestamp)
        && Objects.equals(messageId, that.messageId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type(), userId, anonymousId, properties, context, timestamp, messageId);
  }

  @Override
  public String toString() {
    return type()
        + "{userId="
        + userId
        + ", anonymousId="
        + anonymousId
        + ", properties="
        + properties
        + '}';
  }

  /** Common part of the message builders. */
  public abstract static class Builder<M extends Message, B extends Builder<M, B>> {
    private String userId;
    private String anonymousId;
    private Value.Struct properties = Value.Struct.EMPTY;
    private Value.Struct context = Value.Struct.EMPTY;
    private Instant timestamp;
    private String messageId;

    private Builder() {}

    protected abstract B self();

    public abstract M build();

    public B userId(@Nullable String userId) {
      this.userId = userId;
      return self();
    }

    public B anonymousId(@Nullable String anonymousId) {
      this.anonymousId = anonymousId;
      return self();
    }

    public B properties(@Nonnull Value.Struct properties) {
      this.properties = Objects.requireNonNull(properties);
      return self();
    }

    public B properties(@Nonnull Map<String, ?> properties) {
      return properties(Value.Struct.fromMap(properties));
    }

    public B context(@Nonnull Value.Struct context) {
      this.context = Objects.requireNonNull(context);
      return self();
    }

    public B context(@Nonnull Map<String, ?> context) {
      return context(Value.Struct.fromMap(context));
    }

    /** Time the event happened; defaults to the time the delivery client serializes it. */
    public B timestamp(@Nullable Instant timestamp) {
      this.timestamp = timestamp;
      return self();
    }

    /** Deduplication id; a random UUID is assigned when absent. */
    public B messageId(@Nullable String messageId) {
      this.messageId = messageId;
      return self();
    }
  }

  public static final class Track extends Message {
    @Nullable private final String event;

    private Track(Builder builder) {
      super(builder);
      this.event = builder.event;
    }

    @Override
    public MessageType type() {
      return MessageType.TRACK;
    }

    @Nullable
    public String event() {
      return event;
    }

    @Override
    public boolean equals(Object o) {
      return super.equals(o) && Objects.equals(event, ((Track) o).event);
    }

    @Override
    public int hashCode() {
      return 31 * super.hashCode() + Objects.hashCode(event);
    }

    public static final class Builder extends Message.Builder<Track, Builder> {
      private String event;

      private Builder() {}

      public Builder event(@Nullable String event) {
        this.event = event;
        return this;
      }

      @Override
      protected Builder self() {
        return this;
      }

      @Override
      public Track build() {
        return new Track(this);
      }
    }
  }

  /** Ties a user to their traits, carried in {@link #properties()}. */
  public static final class Identify extends Message {

    private Identify(Builder builder) {
      super(builder);
    }

    @Override
    public MessageType type() {
      return MessageType.IDENTIFY;
    }

    public Value.Struct traits() {
      return properties();
    }

    public static final class Builder extends Message.Builder<Identify, Builder> {

      private Builder() {}

      public Builder traits(@Nonnull Map<String, ?> traits) {
        return properties(traits);
      }

      public Builder traits(@Nonnull Value.Struct traits) {
        return properties(traits);
      }

      @Override
      protected Builder self() {
        return this;
      }

      @Override
      public Identify build() {
        return new Identify(this);
      }
    }
  }

  public static final class Group extends Message {
    @Nullable private final String groupId;

    private Group(Builder builder) {
      super(builder);
      this.groupId = builder.groupId;
    }

    @Override
    public MessageType type() {
      return MessageType.GROUP;
    }

    @Nullable
    public String groupId() {
      return groupId;
    }

    public Value.Struct traits() {
      return properties();
    }

    @Override
    public boolean equals(Object o) {
      return super.equals(o) && Objects.equals(groupId, ((Group) o).groupId);
    }

    @Override
    public int hashCode() {
      return 31 * super.hashCode() + Objects.hashCode(groupId);
    }

    public static final class Builder extends Message.Builder<Group, Builder> {
      private String groupId;

      private Builder() {}

      public Builder groupId(@Nullable String groupId) {
        this.groupId = groupId;
        return this;
      }

      public Builder traits(@Nonnull Map<String, ?> traits) {
        return properties(traits);
      }

      public Builder traits(@Nonnull Value.Struct traits) {
        return properties(traits);
      }

      @Override
      protected Builder self() {
        return this;
      }

      @Override
      public Group build() {
        return new Group(this);
      }
    }
  }

  public static final class Page extends Message {
    @Nullable private final String name;
    @Nullable private final String category;

    private Page(Builder builder) {
      super(builder);
      this.name = builder.name;
      this.category = builder.category;
    }

    @Override
    public MessageType type() {
      return MessageType.PAGE;
    }

    public Optional<String> name() {
      return Optional.ofNullable(name);
    }

    public Optional<String> category() {
      return Optional.ofNullable(category);
    }

    @Override
    public boolean equals(Object o) {
      return super.equals(o)
          && Objects.equals(name, ((Page) o).name)
          && Objects.equals(category, ((Page) o).category);
    }

    @Override
    public int hashCode() {
      return Objects.hash(super.hashCode(), name, category);
    }

    public static final class Builder extends Message.Builder<Page, Builder> {
      private String name;
      private String category;

      private Builder() {}

      public Builder name(@Nullable String name) {
        this.name = name;
        return this;
      }

      public Builder category(@Nullable String category) {
        this.category = category;
        return this;
      }

      @Override
      protected Builder self() {
        return this;
      }

      @Override
      public Page build() {
        return new Page(this);
      }
    }
  }

  public static final class Screen extends Message {
    @Nullable private final String name;
    @Nullable private final String category;

    private Screen(Builder builder) {
      super(builder);
      this.name = builder.name;
      this.category = builder.category;
    }

    @Override
    public MessageType type() {
      return MessageType.SCREEN;
    }

    public Optional<String> name() {
      return Optional.ofNullable(name);
    }

    public Optional<String> category() {
      return Optional.ofNullable(category);
    }

    @Override
    public boolean equals(Object o) {
      return super.equals(o)
          && Objects.equals(name, ((Screen) o).name)
          && Objects.equals(category, ((Screen) o).category);
    }

    @Override
    public int hashCode() {
      return Objects.hash(super.hashCode(), name, category);
    }

    public static final class Builder extends Message.Builder<Screen, Builder> {
      private String name;
      private String category;

      private Builder() {}

      public Builder name(@Nullable String name) {
        this.name = name;
        return this;
      }

      public Builder category(@Nullable String category) {
        this.category = category;
        return this;
      }

      @Override
      protected Builder self() {
        return this;
      }

      @Override
      public Screen build() {
        return new Screen(this);
      }
    }
  }

  /** Links a previous identity ({@code previousId}) to {@code userId}. */
  public static final class Alias extends Message {
    @Nullable private final String previousId;

    private Alias(Builder builder) {
      super(builder);
      this.previousId = builder.previousId;
    }

    @Override
    public MessageType type() {
      return MessageType.ALIAS;
    }

    @Nullable
    public String previousId() {
      return previousId;
    }

    @Override
    public boolean equals(Object o) {
      return super.equals(o) && Objects.equals(previousId, ((Alias) o).previousId);
    }

    @Override
    public int hashCode() {
      return 31 * super.hashCode() + Objects.hashCode(previousId);
    }

    public static final class Builder extends Message.Builder<Alias, Builder> {
      private String previousId;

      private Builder() {}

      public Builder previousId(@Nullable String previousId) {
        this.previousId = previousId;
        return this;
      }

      @Override
      protected Builder self() {
        return this;
      }

      @Override
      public Alias build() {
        return new Alias(this);
      }
    }
  }
}

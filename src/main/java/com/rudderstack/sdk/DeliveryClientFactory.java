package com.rudderstack.sdk;

import javax.annotation.Nonnull;

@FunctionalInterface
public interface DeliveryClientFactory {
  @Nonnull
  DeliveryClient create(@Nonnull Configuration configuration);
}

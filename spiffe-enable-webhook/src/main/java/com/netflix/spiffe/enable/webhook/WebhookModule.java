/*
 * Copyright 2025 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package com.netflix.spiffe.enable.webhook;

import javax.inject.Singleton;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.multibindings.Multibinder;
import com.netflix.archaius.ConfigProxyFactory;
import com.netflix.spiffe.enable.webhook.capability.CapabilityInjector;
import com.netflix.spiffe.enable.webhook.capability.EnvoyProxyInjector;
import com.netflix.spiffe.enable.webhook.capability.SpiffeHelperInjector;

/**
 * Binds the pod mutation engine. Requires {@link ConfigProxyFactory} and a Spectator
 * {@link com.netflix.spectator.api.Registry} from the enclosing injector.
 */
public class WebhookModule extends AbstractModule {

    public static final String CONFIGURATION_PREFIX = "spiffeEnable.webhook";

    @Override
    protected void configure() {
        Multibinder<CapabilityInjector> capabilityInjectors = Multibinder.newSetBinder(binder(), CapabilityInjector.class);
        capabilityInjectors.addBinding().to(SpiffeHelperInjector.class);
        capabilityInjectors.addBinding().to(EnvoyProxyInjector.class);
    }

    @Provides
    @Singleton
    public WebhookConfiguration getWebhookConfiguration(ConfigProxyFactory factory) {
        return factory.newProxy(WebhookConfiguration.class, CONFIGURATION_PREFIX);
    }
}

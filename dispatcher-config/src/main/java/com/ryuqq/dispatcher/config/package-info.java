/**
 * Declarative service configuration loading.
 *
 * <p>{@link com.ryuqq.dispatcher.config.DescriptorLoader} reads a YAML or JSON document keyed by
 * deployment profile and builds the read-only
 * {@link com.ryuqq.dispatcher.core.descriptor.CapabilityDescriptorStore} handed to the selector.</p>
 */
package com.ryuqq.dispatcher.config;

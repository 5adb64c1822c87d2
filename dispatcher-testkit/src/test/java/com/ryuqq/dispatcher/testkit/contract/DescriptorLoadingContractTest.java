package com.ryuqq.dispatcher.testkit.contract;

import com.ryuqq.dispatcher.application.selection.ServiceSelector;
import com.ryuqq.dispatcher.config.DescriptorLoader;
import com.ryuqq.dispatcher.core.descriptor.CapabilityDescriptor;
import com.ryuqq.dispatcher.core.descriptor.CapabilityDescriptorStore;
import com.ryuqq.dispatcher.core.model.BoundingBox;
import com.ryuqq.dispatcher.core.model.OpId;
import com.ryuqq.dispatcher.core.model.Operation;
import com.ryuqq.dispatcher.core.model.RequestContext;
import com.ryuqq.dispatcher.core.model.Source;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Contract Test for descriptor loading idempotence.
 *
 * <p>Two independent loads of the same configuration must select the same service, resolve the
 * same output format and explain a no-match the same way for every request.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
class DescriptorLoadingContractTest extends AbstractContractTest {

    private static final String RESOURCE = "config/contract-services.yml";

    private record Request(Supplier<Operation> operation, RequestContext context) {
    }

    @Test
    void testLoading_Twice_SelectsIdentically() {
        // Given: two stores from independent loads
        ServiceSelector first = new ServiceSelector(new DescriptorLoader().loadResource(RESOURCE));
        ServiceSelector second = new ServiceSelector(new DescriptorLoader().loadResource(RESOURCE));

        List<Request> requests = List.of(
            new Request(() -> createOperation("C1", 1), RequestContext.empty()),
            new Request(() -> createOperation("C1", List.of("red_var"), 1), RequestContext.of("image/png")),
            new Request(() -> createOperation("C1", 2), RequestContext.of("image/*")),
            new Request(() -> createOperation("C2", 4), RequestContext.of("application/x-zarr")),
            new Request(() -> createOperation("C2", List.of("sst"), 1), RequestContext.empty()),
            new Request(() -> Operation.builder(OpId.random(), CALLBACK)
                .source(Source.of("C2"))
                .boundingBox(BoundingBox.of(-20, -20, 20, 20))
                .build(), RequestContext.of("*/*")),
            new Request(() -> createOperation("C9", 1), RequestContext.empty()));

        for (Request request : requests) {
            // When
            Operation left = request.operation().get();
            Operation right = request.operation().get();
            CapabilityDescriptor leftChoice = first.select(left, request.context());
            CapabilityDescriptor rightChoice = second.select(right, request.context());

            // Then
            assertEquals(leftChoice, rightChoice, "Different choice for " + left);
            assertEquals(left.getOutputFormat(), right.getOutputFormat());
        }
    }

    @Test
    void testLoading_Twice_SameDescriptorsInSameOrder() {
        CapabilityDescriptorStore first = new DescriptorLoader().loadResource(RESOURCE);
        CapabilityDescriptorStore second = new DescriptorLoader().loadResource(RESOURCE);

        assertEquals(first.all(), second.all());
    }
}

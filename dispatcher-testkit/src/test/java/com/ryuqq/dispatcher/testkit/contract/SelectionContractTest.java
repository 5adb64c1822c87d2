package com.ryuqq.dispatcher.testkit.contract;

import com.ryuqq.dispatcher.application.selection.OutputFormatStage;
import com.ryuqq.dispatcher.application.selection.ServiceSelector;
import com.ryuqq.dispatcher.application.selection.StageResult;
import com.ryuqq.dispatcher.core.descriptor.Capabilities;
import com.ryuqq.dispatcher.core.descriptor.CapabilityDescriptor;
import com.ryuqq.dispatcher.core.descriptor.CapabilityDescriptorStore;
import com.ryuqq.dispatcher.core.descriptor.Mechanism;
import com.ryuqq.dispatcher.core.model.BoundingBox;
import com.ryuqq.dispatcher.core.model.OpId;
import com.ryuqq.dispatcher.core.model.Operation;
import com.ryuqq.dispatcher.core.model.RequestContext;
import com.ryuqq.dispatcher.core.model.Source;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Contract Test for service selection.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>An empty candidate set always yields the no-match service, never an exception</li>
 *   <li>Unmet variable subsetting is named in the no-match explanation</li>
 *   <li>Format resolution walks the requested types in order</li>
 *   <li>Among equally capable services the first declared wins, every time</li>
 * </ul>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
class SelectionContractTest extends AbstractContractTest {

    private static CapabilityDescriptor service(String name, List<String> formats, boolean variables) {
        return CapabilityDescriptor.of(name, Mechanism.QUEUE, List.of("C1"),
            new Capabilities(formats, variables, false, false, false), Map.of("channel", name));
    }

    @Test
    void testSelection_NoCandidates_AlwaysNoMatch() {
        ServiceSelector selector = new ServiceSelector(CapabilityDescriptorStore.empty());
        Operation withEverything = Operation.builder(OpId.random(), CALLBACK)
            .source(Source.of("C1", List.of("red_var"), List.of()))
            .boundingBox(BoundingBox.of(-10, -10, 10, 10))
            .outputFormat("image/png")
            .build();
        List<Operation> operations = List.of(
            createOperation("C1", 1),
            createOperation("C1", List.of("red_var"), 2),
            withEverything);
        List<RequestContext> contexts = List.of(
            RequestContext.empty(),
            RequestContext.of("*/*"),
            RequestContext.of("image/png", "image/tiff"));

        for (Operation operation : operations) {
            for (RequestContext context : contexts) {
                CapabilityDescriptor chosen = selector.select(operation, context);
                assertTrue(chosen.isNoMatch(), "Expected no-match for " + operation + " with " + context);
                assertTrue(chosen.explanation() != null && !chosen.explanation().isBlank());
            }
        }
    }

    @Test
    void testSelection_VariablesUnsupported_ExplanationNamesVariableSubsetting() {
        ServiceSelector selector = new ServiceSelector(CapabilityDescriptorStore.of(List.of(
            service("reformatter", List.of("image/png"), false))));
        Operation operation = createOperation("C1", List.of("red_var", "green_var"), 1);

        CapabilityDescriptor chosen = selector.select(operation, RequestContext.empty());

        assertTrue(chosen.isNoMatch());
        assertTrue(chosen.explanation().contains("variable subsetting"),
            "Explanation should name variable subsetting: " + chosen.explanation());
    }

    @Test
    void testSelection_PngThenAnything_ResolvesPngAndKeepsOnlyPngService() {
        CapabilityDescriptor tiffOnly = service("tiff-only", List.of("image/tiff"), false);
        CapabilityDescriptor pngAndTiff = service("png-and-tiff", List.of("image/png", "image/tiff"), false);
        RequestContext context = RequestContext.of("image/png", "*/*");

        Operation staged = createOperation("C1", 1);
        StageResult result = new OutputFormatStage().apply(staged, context, List.of(tiffOnly, pngAndTiff));
        StageResult.Narrowed narrowed = assertInstanceOf(StageResult.Narrowed.class, result);
        assertEquals(List.of(pngAndTiff), narrowed.candidates());
        assertEquals("image/png", staged.getOutputFormat());

        Operation selected = createOperation("C1", 1);
        CapabilityDescriptor chosen = new ServiceSelector(CapabilityDescriptorStore.of(List.of(tiffOnly, pngAndTiff)))
            .select(selected, context);
        assertSame(pngAndTiff, chosen);
        assertEquals("image/png", selected.getOutputFormat());
    }

    @Test
    void testSelection_EquallyCapable_FirstDeclaredAlwaysWins() {
        CapabilityDescriptor first = service("first", List.of("image/png"), true);
        CapabilityDescriptor second = service("second", List.of("image/png"), true);
        ServiceSelector selector = new ServiceSelector(CapabilityDescriptorStore.of(List.of(first, second)));

        for (int run = 0; run < 50; run++) {
            CapabilityDescriptor chosen = selector.select(
                createOperation("C1", List.of("red_var"), 1), RequestContext.of("image/*"));
            assertSame(first, chosen, "Run " + run + " chose " + chosen.name());
        }
    }
}

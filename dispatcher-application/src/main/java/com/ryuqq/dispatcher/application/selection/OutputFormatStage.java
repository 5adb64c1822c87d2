package com.ryuqq.dispatcher.application.selection;

import com.ryuqq.dispatcher.core.descriptor.CapabilityDescriptor;
import com.ryuqq.dispatcher.core.model.Operation;
import com.ryuqq.dispatcher.core.model.RequestContext;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 출력 형식 협상 단계.
 *
 * <p>Operation이 형식을 지정했다면 그 형식을, 아니면 요청 컨텍스트의 허용 미디어 타입을
 * 호출자 선호 순서대로 확인합니다. 각 타입에 대해 그 타입을 만족하는 첫 번째 후보(선언 순서)의
 * 선언 형식 중 첫 번째로 일치하는 형식을 구체 형식으로 확정하고 Operation에 기록합니다.
 * 그 뒤 확정된 형식을 제공하는 후보만 남깁니다.</p>
 *
 * <p>와일드카드({@code *}, <code>*&#47;*</code>, {@code image/*})는 서비스가 선언한 순서대로
 * 처음 만족하는 형식으로 확정됩니다.</p>
 *
 * <p>형식도 허용 타입도 없으면 아무것도 하지 않습니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class OutputFormatStage implements EliminationStage {

    @Override
    public StageResult apply(Operation operation, RequestContext context, List<CapabilityDescriptor> candidates) {
        String requested = operation.getOutputFormat();
        if (requested == null && !context.hasRequestedMimeTypes()) {
            return StageResult.of(candidates, reason(operation, context));
        }

        String resolved = requested != null ? requested : resolveFromContext(context, candidates);
        if (resolved == null) {
            return new StageResult.Unsupported(reason(operation, context));
        }

        operation.setOutputFormat(resolved);
        return StageResult.of(offering(resolved, candidates), reason(operation, context));
    }

    private static String resolveFromContext(RequestContext context, List<CapabilityDescriptor> candidates) {
        for (String mimeType : context.requestedMimeTypes()) {
            for (CapabilityDescriptor candidate : candidates) {
                String format = candidate.capabilities().firstFormatAccepting(mimeType);
                if (format != null) {
                    return format;
                }
            }
        }
        return null;
    }

    private static List<CapabilityDescriptor> offering(String format, List<CapabilityDescriptor> candidates) {
        return candidates.stream()
            .filter(descriptor -> descriptor.capabilities().supportsFormat(format))
            .collect(Collectors.toList());
    }

    private static String reason(Operation operation, RequestContext context) {
        String wanted = operation.getOutputFormat() != null
            ? operation.getOutputFormat()
            : String.join(",", context.requestedMimeTypes());
        return "none of the services configured for the collection support reformatting to any of the requested formats ["
            + wanted + "]";
    }
}

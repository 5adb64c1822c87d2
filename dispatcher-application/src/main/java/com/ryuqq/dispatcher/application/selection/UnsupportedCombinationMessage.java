package com.ryuqq.dispatcher.application.selection;

import com.ryuqq.dispatcher.core.model.MediaTypes;
import com.ryuqq.dispatcher.core.model.Operation;
import com.ryuqq.dispatcher.core.model.RequestContext;

import java.util.ArrayList;
import java.util.List;

/**
 * No-op fallback 설명 문구 생성기.
 *
 * <p>제거 단계가 남긴 이유 대신, 요청된 작업(변수 서브세팅, 공간 서브세팅, 형식 변환)을
 * 다시 계산해 어떤 조합이 지원되지 않았는지 컬렉션 이름과 함께 설명합니다.
 * {@code *}, <code>*&#47;*</code> 요청은 형식 변환 요청으로 보지 않습니다.</p>
 *
 * <pre>
 * no operations can be performed on C1
 * the requested combination of operations: variable subsetting and reformatting to image/png on C1 is unsupported
 * </pre>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class UnsupportedCombinationMessage {

    private UnsupportedCombinationMessage() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 설명 문구 생성.
     *
     * @param operation 선택에 실패한 Operation
     * @param context 요청 컨텍스트
     * @return 사람이 읽을 수 있는 설명
     */
    public static String build(Operation operation, RequestContext context) {
        List<String> collections = operation.getCollections();
        List<String> formats = new ArrayList<>();
        List<String> wanted = operation.getOutputFormat() != null
            ? List.of(operation.getOutputFormat())
            : context.requestedMimeTypes();
        for (String format : wanted) {
            if (!MediaTypes.isAnyType(format)) {
                formats.add(format);
            }
        }

        List<String> requestedOptions = new ArrayList<>();
        if (operation.requiresVariableSubsetting()) {
            requestedOptions.add("variable subsetting");
        }
        if (operation.requiresSpatialSubsetting()) {
            requestedOptions.add("spatial subsetting");
        }
        if (!formats.isEmpty()) {
            requestedOptions.add("reformatting to " + listToText(formats));
        }

        if (requestedOptions.isEmpty()) {
            return "no operations can be performed on " + listToText(collections);
        }
        return "the requested combination of operations: " + listToText(requestedOptions)
            + " on " + listToText(collections) + " is unsupported";
    }

    /**
     * 목록을 영어 문장 형태로 연결.
     *
     * <p>"a", "a and b", "a, b, and c"</p>
     *
     * @param items 항목
     * @return 연결된 문자열, 비어 있으면 빈 문자열
     */
    static String listToText(List<String> items) {
        if (items == null || items.isEmpty()) {
            return "";
        }
        if (items.size() == 1) {
            return items.get(0);
        }
        if (items.size() == 2) {
            return items.get(0) + " and " + items.get(1);
        }
        String head = String.join(", ", items.subList(0, items.size() - 1));
        return head + ", and " + items.get(items.size() - 1);
    }
}

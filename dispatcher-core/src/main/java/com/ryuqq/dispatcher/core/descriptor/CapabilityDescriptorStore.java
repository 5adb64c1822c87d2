package com.ryuqq.dispatcher.core.descriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Capability Descriptor 저장소.
 *
 * <p>명시적으로 생성되는 불변 레지스트리입니다. 프로세스 시작 시 설정에서 한 번
 * 만들어 Selector에 공유 참조로 전달하며, 이후 잠금 없이 동시에 읽을 수 있습니다.
 * 선언 순서를 보존하며 이 순서가 최종 tie-break 기준이 됩니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class CapabilityDescriptorStore {

    private final List<CapabilityDescriptor> descriptors;

    private CapabilityDescriptorStore(List<CapabilityDescriptor> descriptors) {
        this.descriptors = Collections.unmodifiableList(new ArrayList<>(descriptors));
    }

    /**
     * 선언 순서대로 저장소 생성.
     *
     * @param descriptors 설명자 목록
     * @return 불변 저장소
     * @throws IllegalArgumentException 목록 또는 원소가 null이거나 이름이 중복된 경우
     */
    public static CapabilityDescriptorStore of(List<CapabilityDescriptor> descriptors) {
        if (descriptors == null) {
            throw new IllegalArgumentException("descriptors cannot be null");
        }
        List<String> names = new ArrayList<>();
        for (CapabilityDescriptor descriptor : descriptors) {
            if (descriptor == null) {
                throw new IllegalArgumentException("descriptors cannot contain null");
            }
            if (names.contains(descriptor.name())) {
                throw new IllegalArgumentException("duplicate service name: " + descriptor.name());
            }
            names.add(descriptor.name());
        }
        return new CapabilityDescriptorStore(descriptors);
    }

    public static CapabilityDescriptorStore empty() {
        return new CapabilityDescriptorStore(List.of());
    }

    /**
     * @return 선언 순서의 불변 설명자 목록
     */
    public List<CapabilityDescriptor> all() {
        return descriptors;
    }

    public int size() {
        return descriptors.size();
    }

    /**
     * 컬렉션을 처리할 수 있는 서비스가 하나라도 있는지 확인.
     *
     * @param collectionId 컬렉션 식별자
     * @return 서비스가 있으면 true
     */
    public boolean supportsCollection(String collectionId) {
        return descriptors.stream().anyMatch(d -> d.collections().contains(collectionId));
    }
}

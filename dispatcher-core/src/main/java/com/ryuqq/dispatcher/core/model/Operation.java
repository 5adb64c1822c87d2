package com.ryuqq.dispatcher.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 데이터 변환 요청 단위 (Operation).
 *
 * <p>요청 검증과 메타데이터 조회 단계가 채운 뒤 전달됩니다. 하나 이상의 소스 컬렉션,
 * 선택적인 공간/시간 범위와 출력 형식, 그리고 Completion Notification을 받을
 * 호출자 주소(callback)를 담습니다.</p>
 *
 * <p><strong>가변성:</strong> outputFormat만 변경 가능합니다. Selector가 출력 형식
 * 협상 결과를 기록할 때 사용합니다. 나머지 필드는 생성 후 변경 불가입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Operation operation = Operation.builder(OpId.random(), "http://localhost:3000/service/abc")
 *     .source(Source.of("C1234-PROV", List.of("red_var"), granules))
 *     .boundingBox(BoundingBox.of(-130, -45, 130, 45))
 *     .build();
 * </pre>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class Operation {

    private final OpId opId;
    private final List<Source> sources;
    private final BoundingBox boundingBox;
    private final TemporalRange temporal;
    private final String callback;
    private volatile String outputFormat;

    private Operation(Builder builder) {
        if (builder.opId == null) {
            throw new IllegalArgumentException("opId cannot be null");
        }
        if (builder.callback == null || builder.callback.isBlank()) {
            throw new IllegalArgumentException("callback cannot be null or blank");
        }
        if (builder.sources.isEmpty()) {
            throw new IllegalArgumentException("sources cannot be empty");
        }
        this.opId = builder.opId;
        this.sources = List.copyOf(builder.sources);
        this.boundingBox = builder.boundingBox;
        this.temporal = builder.temporal;
        this.callback = builder.callback;
        this.outputFormat = builder.outputFormat;
    }

    public static Builder builder(OpId opId, String callback) {
        return new Builder(opId, callback);
    }

    public OpId getOpId() {
        return opId;
    }

    public List<Source> getSources() {
        return sources;
    }

    /**
     * @return 공간 범위 또는 null (공간 서브세팅 미요청)
     */
    public BoundingBox getBoundingBox() {
        return boundingBox;
    }

    /**
     * @return 시간 범위 또는 null
     */
    public TemporalRange getTemporal() {
        return temporal;
    }

    public String getCallback() {
        return callback;
    }

    /**
     * @return 요청되었거나 협상된 출력 형식, 없으면 null
     */
    public String getOutputFormat() {
        return outputFormat;
    }

    public void setOutputFormat(String outputFormat) {
        this.outputFormat = outputFormat;
    }

    public boolean requiresVariableSubsetting() {
        return sources.stream().anyMatch(Source::hasVariables);
    }

    public boolean requiresSpatialSubsetting() {
        return boundingBox != null;
    }

    public List<String> getCollections() {
        List<String> collections = new ArrayList<>(sources.size());
        for (Source source : sources) {
            collections.add(source.collection());
        }
        return collections;
    }

    /**
     * 전체 입력 단위(granule) 수.
     *
     * @return 모든 소스의 granule 합계
     */
    public int getGranuleCount() {
        return sources.stream().mapToInt(s -> s.granules().size()).sum();
    }

    /**
     * 입력 단위 하나만 담은 하위 Operation 목록으로 분할.
     *
     * <p>소스 순서, 소스 내 granule 순서를 그대로 유지합니다. 하위 Operation은
     * {@link OpId#child(int)} 식별자와 자신만의 completion 주소({@link #unitCallback(int)})를 받고,
     * 부모의 공간/시간 범위, 출력 형식을 물려받습니다. granule이 하나도 없으면 부모 자신의 사본 하나를 반환합니다.</p>
     *
     * @return 입력 순서대로 정렬된 하위 Operation 목록 (최소 1개)
     */
    public List<Operation> splitByGranule() {
        List<Operation> units = new ArrayList<>();
        int index = 0;
        for (Source source : sources) {
            for (Granule granule : source.granules()) {
                index++;
                units.add(copyWith(index, List.of(source.withSingleGranule(granule))));
            }
        }
        if (units.isEmpty()) {
            units.add(copyWith(1, sources));
        }
        return units;
    }

    /**
     * callback만 바꾼 사본.
     *
     * @param newCallback 새 completion 주소
     * @return 새 Operation
     */
    public Operation withCallback(String newCallback) {
        return new Builder(opId, newCallback)
            .sources(sources)
            .boundingBox(boundingBox)
            .temporal(temporal)
            .outputFormat(outputFormat)
            .build();
    }

    /**
     * 하위 Operation의 completion 주소.
     *
     * <p>부모 주소의 경로 끝에 {@code /units/N}을 붙이고 query는 그대로 둡니다.</p>
     * <pre>
     * http://localhost:3000/service/job-1        → http://localhost:3000/service/job-1/units/2
     * http://localhost:3000/service/job-1?x=1    → http://localhost:3000/service/job-1/units/2?x=1
     * </pre>
     *
     * @param index 1부터 시작하는 단위 번호
     * @return 단위 전용 completion 주소
     */
    public String unitCallback(int index) {
        if (index < 1) {
            throw new IllegalArgumentException("index must be positive: " + index);
        }
        int query = callback.indexOf('?');
        String path = query < 0 ? callback : callback.substring(0, query);
        String suffix = query < 0 ? "" : callback.substring(query);
        if (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return path + "/units/" + index + suffix;
    }

    private Operation copyWith(int index, List<Source> childSources) {
        return new Builder(opId.child(index), unitCallback(index))
            .sources(childSources)
            .boundingBox(boundingBox)
            .temporal(temporal)
            .outputFormat(outputFormat)
            .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Operation other = (Operation) o;
        return opId.equals(other.opId)
            && sources.equals(other.sources)
            && Objects.equals(boundingBox, other.boundingBox)
            && Objects.equals(temporal, other.temporal)
            && callback.equals(other.callback)
            && Objects.equals(outputFormat, other.outputFormat);
    }

    @Override
    public int hashCode() {
        return opId.hashCode();
    }

    @Override
    public String toString() {
        return "Operation{opId=" + opId.getValue()
            + ", collections=" + getCollections()
            + ", granules=" + getGranuleCount()
            + ", outputFormat=" + outputFormat + '}';
    }

    /**
     * Operation 빌더.
     */
    public static final class Builder {

        private final OpId opId;
        private final String callback;
        private final List<Source> sources = new ArrayList<>();
        private BoundingBox boundingBox;
        private TemporalRange temporal;
        private String outputFormat;

        private Builder(OpId opId, String callback) {
            this.opId = opId;
            this.callback = callback;
        }

        public Builder source(Source source) {
            if (source == null) {
                throw new IllegalArgumentException("source cannot be null");
            }
            this.sources.add(source);
            return this;
        }

        public Builder sources(List<Source> sources) {
            sources.forEach(this::source);
            return this;
        }

        public Builder boundingBox(BoundingBox boundingBox) {
            this.boundingBox = boundingBox;
            return this;
        }

        public Builder temporal(TemporalRange temporal) {
            this.temporal = temporal;
            return this;
        }

        public Builder outputFormat(String outputFormat) {
            this.outputFormat = outputFormat;
            return this;
        }

        public Operation build() {
            return new Operation(this);
        }
    }
}

package com.ryuqq.dispatcher.adapter.invoker;

import java.io.IOException;
import java.util.List;

/**
 * 자식 프로세스 실행기.
 *
 * <p>기본 구현은 {@link ProcessBuilder}를 사용합니다. 테스트는 가짜 {@link Process}를 돌려주는
 * 구현으로 대체합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProcessLauncher {

    /**
     * 프로세스 시작.
     *
     * @param command 실행할 명령과 인자
     * @return 시작된 프로세스
     * @throws IOException 프로세스를 시작할 수 없는 경우
     */
    Process launch(List<String> command) throws IOException;

    /**
     * {@link ProcessBuilder} 기반 실행기.
     *
     * @return 기본 실행기
     */
    static ProcessLauncher system() {
        return command -> new ProcessBuilder(command).start();
    }
}

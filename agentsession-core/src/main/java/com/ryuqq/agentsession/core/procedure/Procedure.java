package com.ryuqq.agentsession.core.procedure;

import java.util.List;
import java.util.Optional;

/**
 * 순서가 있는 Subroutine 목록으로 구성된 작업 절차.
 *
 * @param name 절차 이름 (예: "full-development")
 * @param description 설명
 * @param subroutines 단계 목록 (1개 이상)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Procedure(
    String name,
    String description,
    List<Subroutine> subroutines
) {

    public Procedure {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (subroutines == null || subroutines.isEmpty()) {
            throw new IllegalArgumentException("subroutines cannot be null or empty");
        }
        description = description == null ? "" : description;
        subroutines = List.copyOf(subroutines);
    }

    /**
     * 인덱스의 단계 조회.
     *
     * @param index 0부터 시작하는 인덱스
     * @return 범위 밖이면 empty
     */
    public Optional<Subroutine> subroutineAt(int index) {
        if (index < 0 || index >= subroutines.size()) {
            return Optional.empty();
        }
        return Optional.of(subroutines.get(index));
    }

    public int size() {
        return subroutines.size();
    }
}

package com.ryuqq.agentsession.core.session;

/**
 * 세션이 바인딩된 외부 작업 단위의 최소 정보.
 *
 * @param id 작업 ID
 * @param identifier 사람이 읽는 키 (예: "ENG-42")
 * @param title 제목
 * @param url 링크 (null 가능)
 * @param branchName 작업 브랜치 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WorkItem(String id, String identifier, String title, String url, String branchName) {

    public WorkItem {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
    }

    public static WorkItem of(String id, String identifier, String title) {
        return new WorkItem(id, identifier, title, null, null);
    }

    /**
     * 사용자 노출용 제목.
     *
     * @return title, 없으면 identifier, 없으면 id
     */
    public String displayTitle() {
        if (title != null && !title.isBlank()) {
            return title;
        }
        return identifier != null ? identifier : id;
    }
}

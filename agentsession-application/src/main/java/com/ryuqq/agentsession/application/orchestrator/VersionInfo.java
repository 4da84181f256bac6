package com.ryuqq.agentsession.application.orchestrator;

/**
 * 버전 정보 응답.
 *
 * @param name 패키지 이름
 * @param version 패키지 버전 (manifest에 없으면 "development")
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record VersionInfo(String name, String version) {

    static final String DEVELOPMENT_VERSION = "development";

    static VersionInfo of(Class<?> type) {
        Package pkg = type.getPackage();
        String title = pkg == null ? null : pkg.getImplementationTitle();
        String version = pkg == null ? null : pkg.getImplementationVersion();
        return new VersionInfo(
            title == null ? "agentsession-application" : title,
            version == null ? DEVELOPMENT_VERSION : version);
    }
}

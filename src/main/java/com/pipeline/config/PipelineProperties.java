package com.pipeline.config;

import com.pipeline.model.ServiceConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings bound from the {@code pipeline.*} namespace of {@code application.yml}.
 * <p>
 * Example:
 * <pre>
 * pipeline:
 *   worker-pool-cap: 5
 *   services:
 *     kakao:
 *       base-url: https://dapi.kakao.com
 *       auth:
 *         type: header
 *         header-name: Authorization
 *         env-var: KAKAO_REST_API_KEY
 *         prefix: "KakaoAK "
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    /**
     * Backend services, keyed by the name steps use in their {@code service} field.
     */
    private Map<String, ServiceConfig> services = new LinkedHashMap<>();

    /**
     * Upper bound on concurrent workers for one parallel pipeline run.
     */
    private int workerPoolCap = 5;

    /**
     * Per-attempt timeout when neither the step nor its service sets one.
     */
    private int defaultTimeoutSeconds = 10;
}

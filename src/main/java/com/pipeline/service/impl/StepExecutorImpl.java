package com.pipeline.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pipeline.config.PipelineProperties;
import com.pipeline.model.AuthConfig;
import com.pipeline.model.FormValue;
import com.pipeline.model.HttpCall;
import com.pipeline.model.JsonBodyTemplate;
import com.pipeline.model.PipelineStep;
import com.pipeline.model.ResponseFormat;
import com.pipeline.model.RetryPolicy;
import com.pipeline.model.ServiceConfig;
import com.pipeline.service.api.AuthResolver;
import com.pipeline.service.api.HttpExecutor;
import com.pipeline.service.api.ServiceRegistry;
import com.pipeline.service.api.StepExecutor;
import com.pipeline.transform.JsonValues;
import com.pipeline.transform.TemplateRenderer;
import com.pipeline.transform.TransformEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Service
@Slf4j
public class StepExecutorImpl implements StepExecutor {

    static final String SPREAD = "_spread";

    private final ServiceRegistry serviceRegistry;
    private final AuthResolver authResolver;
    private final HttpExecutor httpExecutor;
    private final ReferenceResolver referenceResolver;
    private final TransformEngine transformEngine;
    private final PipelineProperties properties;

    public StepExecutorImpl(ServiceRegistry serviceRegistry,
                            AuthResolver authResolver,
                            HttpExecutor httpExecutor,
                            ReferenceResolver referenceResolver,
                            TransformEngine transformEngine,
                            PipelineProperties properties) {
        this.serviceRegistry = serviceRegistry;
        this.authResolver = authResolver;
        this.httpExecutor = httpExecutor;
        this.referenceResolver = referenceResolver;
        this.transformEngine = transformEngine;
        this.properties = properties;
    }

    @Override
    public JsonNode execute(PipelineStep step, JsonNode input, Map<String, JsonNode> stepOutputs) {
        Optional<ServiceConfig> found = serviceRegistry.find(step.getService());
        if (found.isEmpty()) {
            return JsonValues.error("Unknown service: " + step.getService());
        }
        ServiceConfig service = found.get();
        AuthConfig auth = service.getAuth() != null ? service.getAuth() : new AuthConfig();

        Optional<String> authError = authResolver.validate(step.getService(), auth);
        if (authError.isPresent()) {
            log.warn("Step '{}' cannot call '{}': {}", step.getId(), step.getService(), authError.get());
            return JsonValues.error(authError.get());
        }

        String baseUrl = StringUtils.hasText(step.getBaseUrl()) ? step.getBaseUrl() : nullToEmpty(service.getBaseUrl());
        String url = baseUrl + TemplateRenderer.simple().render(step.getEndpoint(),
                key -> JsonValues.asText(input.get(key)));

        ObjectNode params = buildParams(step, input, authResolver.queryParams(step.getService(), auth));
        referenceResolver.resolveValues(params, stepOutputs);

        Map<String, String> headers = new LinkedHashMap<>(authResolver.headers(step.getService(), auth));
        Map<String, String> stepHeaders = new LinkedHashMap<>(step.getHeaders());
        referenceResolver.resolveValues(stepHeaders, stepOutputs);
        headers.putAll(stepHeaders);

        JsonNode jsonBody = buildJsonBody(step.getJsonBody(), input);
        if (jsonBody != null && jsonBody.isObject()) {
            referenceResolver.resolveValues((ObjectNode) jsonBody, stepOutputs);
        }
        Map<String, String> formBody = buildFormBody(step.getFormBody(), input);
        referenceResolver.resolveValues(formBody, stepOutputs);

        HttpCall call = new HttpCall(
                step.getMethod(),
                url,
                headers,
                params,
                jsonBody,
                formBody,
                timeoutFor(step, service),
                formatFor(step, service),
                retryFor(step, service));
        log.debug("Step '{}': {} {} params={}", step.getId(), call.method(), call.url(), params);

        JsonNode raw = httpExecutor.execute(call);
        if (JsonValues.isError(raw)) {
            return raw;
        }
        if (step.getResponse() != null) {
            return transformEngine.transform(raw, step.getResponse(), input);
        }
        return raw;
    }

    /**
     * Default params, then the auth param, then mapped input values, then any {@code defaults}
     * entry that is neither mapped nor already present.
     */
    ObjectNode buildParams(PipelineStep step, JsonNode input, Map<String, String> authParams) {
        ObjectNode params = JsonNodeFactory.instance.objectNode();
        if (step.getDefaultParams() != null) {
            params.setAll(step.getDefaultParams().deepCopy());
        }
        authParams.forEach(params::put);

        ObjectNode defaults = step.getDefaults() != null ? step.getDefaults() : JsonNodeFactory.instance.objectNode();
        step.getParamMap().forEach((inputKey, apiParam) -> {
            if (SPREAD.equals(apiParam)) {
                JsonNode spread = input.get(inputKey);
                if (spread != null && spread.isObject()) {
                    params.setAll(((ObjectNode) spread).deepCopy());
                }
                return;
            }
            JsonNode value = input.get(inputKey);
            if (JsonValues.isNull(value)) {
                value = defaults.get(inputKey);
            }
            if (!JsonValues.isNull(value)) {
                params.set(apiParam, value.deepCopy());
            }
        });

        defaults.fieldNames().forEachRemaining(key -> {
            if (!step.getParamMap().containsKey(key) && !params.has(key)) {
                params.set(key, defaults.get(key).deepCopy());
            }
        });
        return params;
    }

    private static JsonNode buildJsonBody(JsonBodyTemplate template, JsonNode input) {
        if (template == null) {
            return null;
        }
        if (template.literal() != null) {
            return template.literal().deepCopy();
        }
        ObjectNode body = template.defaults() != null
                ? template.defaults().deepCopy()
                : JsonNodeFactory.instance.objectNode();
        template.paramMap().forEach((inputKey, bodyKey) -> {
            JsonNode value = input.get(inputKey);
            if (!JsonValues.isNull(value)) {
                body.set(bodyKey, value.deepCopy());
            }
        });
        return body.isEmpty() ? null : body;
    }

    private Map<String, String> buildFormBody(Map<String, FormValue> template, JsonNode input) {
        if (template.isEmpty()) {
            return null;
        }
        Map<String, String> form = new LinkedHashMap<>();
        template.forEach((key, value) -> {
            if (value instanceof FormValue.Env env) {
                form.put(key, authResolver.secret(env.name()));
            } else if (value instanceof FormValue.FromInput fromInput) {
                form.put(key, JsonValues.asText(input.get(fromInput.key())));
            } else {
                form.put(key, JsonValues.asText(((FormValue.Literal) value).value()));
            }
        });
        return form;
    }

    private int timeoutFor(PipelineStep step, ServiceConfig service) {
        if (step.getTimeout() != null) {
            return step.getTimeout();
        }
        if (service.getTimeout() != null && service.getTimeout() > 0) {
            return service.getTimeout();
        }
        return properties.getDefaultTimeoutSeconds();
    }

    private static ResponseFormat formatFor(PipelineStep step, ServiceConfig service) {
        if (step.getResponseType() != null) {
            return step.getResponseType();
        }
        return service.getResponseFormat() != null ? service.getResponseFormat() : ResponseFormat.JSON;
    }

    private static RetryPolicy retryFor(PipelineStep step, ServiceConfig service) {
        return step.getRetry() != null ? step.getRetry() : service.getRetry();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}

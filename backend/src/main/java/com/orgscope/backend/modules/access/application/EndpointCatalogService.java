package com.orgscope.backend.modules.access.application;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.mvc.method.RequestMappingInfo;
import org.springframework.web.servlet.mvc.method.annotation.RequestMappingHandlerMapping;

import com.orgscope.backend.modules.access.config.AccessPolicyProperties;
import com.orgscope.backend.modules.access.presentation.dto.EndpointResponse;

/**
 * Lists the API endpoints that permission overrides can target, read from the registered MVC
 * mappings. Overrides match concrete request paths, so a templated pattern is reported with the
 * base path a grant has to use instead.
 */
@Service
public class EndpointCatalogService {

    private static final String API_PREFIX = "/api/";

    private final RequestMappingHandlerMapping handlerMapping;
    private final int basePathSegments;

    public EndpointCatalogService(
            @Qualifier("requestMappingHandlerMapping") RequestMappingHandlerMapping handlerMapping,
            AccessPolicyProperties properties
    ) {
        this.handlerMapping = handlerMapping;
        this.basePathSegments = properties.basePathSegments();
    }

    public List<EndpointResponse> listEndpoints() {
        List<EndpointResponse> endpoints = new ArrayList<>();
        for (Map.Entry<RequestMappingInfo, HandlerMethod> entry : handlerMapping.getHandlerMethods().entrySet()) {
            RequestMappingInfo info = entry.getKey();
            HandlerMethod handler = entry.getValue();
            String handlerName = handler.getBeanType().getSimpleName() + "#" + handler.getMethod().getName();
            for (String pattern : info.getPatternValues()) {
                if (!pattern.startsWith(API_PREFIX)) {
                    continue;
                }
                String grantPath = grantPathFor(pattern);
                for (String method : methodsOf(info)) {
                    endpoints.add(new EndpointResponse(pattern, method, handlerName, grantPath));
                }
            }
        }
        endpoints.sort(Comparator.comparing(EndpointResponse::path).thenComparing(EndpointResponse::method));
        return endpoints;
    }

    /**
     * The path a grant must name to cover {@code pattern}: the pattern itself when it has no
     * template variables, else its base path, or null when the base path is still templated.
     */
    String grantPathFor(String pattern) {
        if (!PermissionOverride.isTemplated(pattern)) {
            return pattern;
        }
        String base = PermissionOverride.basePath(PermissionOverride.normalizePath(pattern), basePathSegments);
        return PermissionOverride.isTemplated(base) ? null : base;
    }

    private static Set<String> methodsOf(RequestMappingInfo info) {
        Set<String> methods = new TreeSet<>();
        Set<RequestMethod> declared = info.getMethodsCondition().getMethods();
        if (declared.isEmpty()) {
            methods.addAll(PermissionOverride.SUPPORTED_METHODS);
            return methods;
        }
        for (RequestMethod method : declared) {
            if (PermissionOverride.SUPPORTED_METHODS.contains(method.name())) {
                methods.add(method.name());
            }
        }
        return methods;
    }
}

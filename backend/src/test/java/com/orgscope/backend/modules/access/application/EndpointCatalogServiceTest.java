package com.orgscope.backend.modules.access.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.mvc.method.RequestMappingInfo;
import org.springframework.web.servlet.mvc.method.annotation.RequestMappingHandlerMapping;

import com.orgscope.backend.modules.access.config.AccessPolicyProperties;
import com.orgscope.backend.modules.access.presentation.dto.EndpointResponse;

class EndpointCatalogServiceTest {

    @Test
    @DisplayName("템플릿 경로는 권한 부여에 쓸 기본 경로와 함께 나열되고 /api 밖의 매핑은 빠진다")
    void templatedPatternsCarryTheirGrantPath() throws Exception {
        Map<RequestMappingInfo, HandlerMethod> mappings = new LinkedHashMap<>();
        SampleController controller = new SampleController();
        mappings.put(RequestMappingInfo.paths("/api/v1/employees/{id}").methods(RequestMethod.GET).build(),
                new HandlerMethod(controller, "getEmployee", Long.class));
        mappings.put(RequestMappingInfo.paths("/api/v1/employees").methods(RequestMethod.POST).build(),
                new HandlerMethod(controller, "createEmployee"));
        mappings.put(RequestMappingInfo.paths("/actuator/health").methods(RequestMethod.GET).build(),
                new HandlerMethod(controller, "health"));
        RequestMappingHandlerMapping handlerMapping = mock(RequestMappingHandlerMapping.class);
        when(handlerMapping.getHandlerMethods()).thenReturn(mappings);

        EndpointCatalogService catalog = new EndpointCatalogService(handlerMapping, AccessPolicyProperties.defaults());

        assertThat(catalog.listEndpoints())
                .extracting(EndpointResponse::path, EndpointResponse::method, EndpointResponse::grantPath)
                .containsExactly(
                        tuple("/api/v1/employees", "POST", "/api/v1/employees"),
                        tuple("/api/v1/employees/{id}", "GET", "/api/v1/employees"));
    }

    @Test
    @DisplayName("기본 경로까지 템플릿이면 권한 경로가 없다")
    void templatedBasePathHasNoGrantPath() {
        EndpointCatalogService catalog = new EndpointCatalogService(mock(RequestMappingHandlerMapping.class),
                AccessPolicyProperties.defaults());

        assertThat(catalog.grantPathFor("/api/{version}/employees/{id}")).isNull();
        assertThat(catalog.grantPathFor("/api/v1/users/{userId}/scopes")).isEqualTo("/api/v1/users");
    }

    static class SampleController {

        public void getEmployee(Long id) {
        }

        public void createEmployee() {
        }

        public void health() {
        }
    }
}

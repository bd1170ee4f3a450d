package com.aura.trigger.http;

import com.aura.api.dto.HealthStatusDTO;
import com.aura.api.response.Response;
import com.aura.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 存活探针。
 */
@RestController
@RequestMapping("/api")
public class HealthController {

    @GetMapping("/health")
    public Response<HealthStatusDTO> health() {
        HealthStatusDTO data = new HealthStatusDTO();
        data.setStatus("healthy");
        data.setBackend("running");
        data.setReady(true);
        return Response.<HealthStatusDTO>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}

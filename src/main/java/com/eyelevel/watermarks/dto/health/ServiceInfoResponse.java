package com.eyelevel.watermarks.dto.health;

public record ServiceInfoResponse(String service, String status, String version) {
}

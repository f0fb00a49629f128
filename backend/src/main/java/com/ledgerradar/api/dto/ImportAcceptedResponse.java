package com.ledgerradar.api.dto;

import java.util.List;

/**
 * 202 body of an upload: the job to poll.
 */
public record ImportAcceptedResponse(String jobId, String status, String format, List<String> advisories) {
}

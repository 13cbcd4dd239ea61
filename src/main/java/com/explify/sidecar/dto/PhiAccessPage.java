package com.explify.sidecar.dto;

import java.util.List;

public record PhiAccessPage(long total, List<PhiAccessEntry> items) {
}

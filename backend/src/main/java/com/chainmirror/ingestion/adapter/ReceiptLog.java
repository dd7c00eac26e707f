package com.chainmirror.ingestion.adapter;

import java.util.List;

public record ReceiptLog(String address, List<String> topics, String data, int logIndex) {
}

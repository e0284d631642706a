package com.platform.resilience.graph;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives caller/callee observations from Jaeger query API payloads.
 * 
 * A span's parent comes from its first CHILD_OF or FOLLOWS_FROM reference that resolves to a
 * known span, else from {@code parentSpanId}. The pair is async when the reference is
 * FOLLOWS_FROM or the spans are a producer/consumer pair. A trace without any cross-service
 * reference contributes its time-ordered service transitions instead.
 */
public class SpanRelationshipExtractor {
    
    private static final String SPAN_KIND = "span.kind";
    
    /**
     * Extract calls from a {@code /traces} payload ({@code {"data": [trace, ...]}}).
     */
    public List<ObservedCall> fromTraces(JsonNode payload) {
        Map<CallKey, Long> counts = new LinkedHashMap<>();
        if (payload == null) {
            return List.of();
        }
        for (JsonNode trace : payload.path("data")) {
            extractTrace(trace, counts);
        }
        return toCalls(counts);
    }
    
    /**
     * Extract calls from a {@code /dependencies} payload: either a bare array or {@code {"data": [...]}},
     * rows keyed parent/child, caller/callee or p/c.
     */
    public List<ObservedCall> fromDependencySummary(JsonNode payload) {
        Map<CallKey, Long> counts = new LinkedHashMap<>();
        if (payload == null) {
            return List.of();
        }
        JsonNode rows = payload.isArray() ? payload : payload.path("data");
        for (JsonNode row : rows) {
            String parent = firstText(row, "parent", "caller", "p");
            String child = firstText(row, "child", "callee", "c");
            if (parent == null || child == null || parent.equals(child)) {
                continue;
            }
            long callCount = firstLong(row, "callCount", "calls", "count");
            counts.merge(new CallKey(parent, child, Transport.SYNC), callCount, Long::sum);
        }
        return toCalls(counts);
    }
    
    private void extractTrace(JsonNode trace, Map<CallKey, Long> counts) {
        JsonNode processes = trace.path("processes");
        JsonNode spans = trace.path("spans");
        Map<String, String> serviceBySpan = new HashMap<>();
        Map<String, String> kindBySpan = new HashMap<>();
        for (JsonNode span : spans) {
            String service = processes.path(span.path("processID").asText()).path("serviceName").asText(null);
            String spanId = span.path("spanID").asText(null);
            if (service != null && !service.isEmpty() && spanId != null) {
                serviceBySpan.put(spanId, service);
                kindBySpan.put(spanId, spanKind(span));
            }
        }
        
        int added = 0;
        for (JsonNode span : spans) {
            String spanId = span.path("spanID").asText(null);
            String child = serviceBySpan.get(spanId);
            String parentSpan = null;
            boolean followsFrom = false;
            for (JsonNode ref : span.path("references")) {
                String refType = ref.path("refType").asText();
                if (("CHILD_OF".equals(refType) || "FOLLOWS_FROM".equals(refType)) 
                        && serviceBySpan.containsKey(ref.path("spanID").asText())) {
                    parentSpan = ref.path("spanID").asText();
                    followsFrom = "FOLLOWS_FROM".equals(refType);
                    break;
                }
            }
            if (parentSpan == null) {
                String declared = firstText(span, "parentSpanId", "parentSpanID");
                if (declared != null && serviceBySpan.containsKey(declared)) {
                    parentSpan = declared;
                }
            }
            String parent = parentSpan == null ? null : serviceBySpan.get(parentSpan);
            if (parent == null || child == null || parent.equals(child)) {
                continue;
            }
            boolean async = followsFrom 
                || ("producer".equals(kindBySpan.get(parentSpan)) && "consumer".equals(kindBySpan.get(spanId)));
            counts.merge(new CallKey(parent, child, async ? Transport.ASYNC : Transport.SYNC), 1L, Long::sum);
            added++;
        }
        
        if (added == 0 && spans.size() > 0) {
            addTransitions(spans, serviceBySpan, counts);
        }
    }
    
    private void addTransitions(JsonNode spans, Map<String, String> serviceBySpan, Map<CallKey, Long> counts) {
        List<TimedService> sequence = new ArrayList<>();
        for (JsonNode span : spans) {
            String service = serviceBySpan.get(span.path("spanID").asText(null));
            if (service == null) {
                continue;
            }
            sequence.add(new TimedService(firstLong(span, "startTime", "startTimeMillis", "startTimeUnixNano"), service));
        }
        sequence.sort(Comparator.comparingLong(TimedService::start).thenComparing(TimedService::service));
        String last = null;
        List<String> ordered = new ArrayList<>();
        for (TimedService entry : sequence) {
            if (!entry.service().equals(last)) {
                ordered.add(entry.service());
                last = entry.service();
            }
        }
        for (int i = 0; i + 1 < ordered.size(); i++) {
            counts.merge(new CallKey(ordered.get(i), ordered.get(i + 1), Transport.SYNC), 1L, Long::sum);
        }
    }
    
    private static String spanKind(JsonNode span) {
        for (JsonNode tag : span.path("tags")) {
            if (SPAN_KIND.equals(tag.path("key").asText())) {
                return tag.path("value").asText();
            }
        }
        return null;
    }
    
    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull() && !value.asText().isEmpty()) {
                return value.asText();
            }
        }
        return null;
    }
    
    private static long firstLong(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull()) {
                long parsed = value.asLong(0);
                if (parsed != 0) {
                    return parsed;
                }
            }
        }
        return 0;
    }
    
    private static List<ObservedCall> toCalls(Map<CallKey, Long> counts) {
        List<ObservedCall> calls = new ArrayList<>(counts.size());
        counts.forEach((key, count) -> calls.add(new ObservedCall(key.caller(), key.callee(), key.transport(), count)));
        return calls;
    }
    
    private record CallKey(String caller, String callee, Transport transport) {
    }
    
    private record TimedService(long start, String service) {
    }
}

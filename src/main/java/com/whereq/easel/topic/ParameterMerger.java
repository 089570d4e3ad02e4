package com.whereq.easel.topic;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Computes the effective parameters of a request.
 *
 * Precedence, lowest first: rule defaults, topic defaults, request overrides. A default
 * width or height of {@code 0} is taken from the input image when its size is known.
 * Overrides are lower-cased, filtered by the topic's allow-list and clamped to its limits.
 * Width and height are clamped together so the aspect ratio survives clamping.
 */
@Slf4j
@Component
public class ParameterMerger {

    static final String WIDTH = "width";
    static final String HEIGHT = "height";

    public Map<String, Object> merge(TopicConfig topic, Map<String, Object> overrides) {
        return merge(topic, overrides, null);
    }

    /**
     * @param topic     topic supplying defaults, allow-list and limits
     * @param overrides request parameters, may be {@code null}
     * @param inputSize size of the first input image, or {@code null}
     */
    public Map<String, Object> merge(TopicConfig topic, Map<String, Object> overrides, ImageSize inputSize) {
        Map<String, Object> params = new LinkedHashMap<>(topic.getNodeDefaults());
        params.putAll(topic.getDefaults());

        if (inputSize != null) {
            if (isZero(params.get(WIDTH))) {
                params.put(WIDTH, inputSize.getWidth());
            }
            if (isZero(params.get(HEIGHT))) {
                params.put(HEIGHT, inputSize.getHeight());
            }
        }

        Map<String, Object> accepted = new LinkedHashMap<>();
        if (overrides != null) {
            overrides.forEach((key, value) -> {
                String name = key.toLowerCase(Locale.ROOT);
                if (topic.isInlineAllowed(name)) {
                    accepted.put(name, value);
                } else {
                    log.debug("Override {} not allowed for topic {}", name, topic.getAlias());
                }
            });
        }

        Map<String, NumericLimit> limits = topic.getInlineLimits();
        accepted.forEach((name, value) -> {
            if (!name.equals(WIDTH) && !name.equals(HEIGHT)) {
                params.put(name, clamp(limits.get(name), value));
            }
        });

        Object width = accepted.containsKey(WIDTH) ? accepted.get(WIDTH) : params.get(WIDTH);
        Object height = accepted.containsKey(HEIGHT) ? accepted.get(HEIGHT) : params.get(HEIGHT);
        applyDimensions(params, width, height, limits.get(WIDTH), limits.get(HEIGHT));
        return params;
    }

    private static void applyDimensions(Map<String, Object> params, Object width, Object height,
                                        NumericLimit widthLimit, NumericLimit heightLimit) {
        if (width instanceof Number && height instanceof Number) {
            double w0 = ((Number) width).doubleValue();
            double h0 = ((Number) height).doubleValue();
            double wPre = clamp(widthLimit, w0);
            double hPre = clamp(heightLimit, h0);

            List<Double> scales = new ArrayList<>();
            if (wPre != w0 && w0 != 0) {
                scales.add(wPre / w0);
            }
            if (hPre != h0 && h0 != 0) {
                scales.add(hPre / h0);
            }

            if (scales.isEmpty()) {
                params.put(WIDTH, (int) Math.round(clamp(widthLimit, w0)));
                params.put(HEIGHT, (int) Math.round(clamp(heightLimit, h0)));
                return;
            }

            // shrinking wins over growing: the tightest shrink keeps both dimensions under their max
            double scale = scales.stream().filter(s -> s < 1.0).min(Double::compare)
                .orElseGet(() -> scales.stream().filter(s -> s > 1.0).max(Double::compare).orElse(1.0));
            params.put(WIDTH, (int) clamp(widthLimit, Math.round(w0 * scale)));
            params.put(HEIGHT, (int) clamp(heightLimit, Math.round(h0 * scale)));
            return;
        }

        if (width instanceof Number) {
            params.put(WIDTH, (int) Math.round(clamp(widthLimit, ((Number) width).doubleValue())));
        }
        if (height instanceof Number) {
            params.put(HEIGHT, (int) Math.round(clamp(heightLimit, ((Number) height).doubleValue())));
        }
    }

    /**
     * Clamp numbers, keeping integral values integral; anything else passes through
     */
    static Object clamp(NumericLimit limit, Object value) {
        if (limit == null || !(value instanceof Number)) {
            return value;
        }
        double clamped = limit.clamp(((Number) value).doubleValue());
        if (value instanceof Integer) {
            return (int) clamped;
        }
        if (value instanceof Long) {
            return (long) clamped;
        }
        return clamped;
    }

    private static double clamp(NumericLimit limit, double value) {
        return limit == null ? value : limit.clamp(value);
    }

    private static boolean isZero(Object value) {
        return (value instanceof Integer || value instanceof Long) && ((Number) value).longValue() == 0L;
    }

    /**
     * Pixel size of an input image
     */
    @Value
    public static class ImageSize {
        int width;
        int height;
    }
}

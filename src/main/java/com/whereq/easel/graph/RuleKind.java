package com.whereq.easel.graph;

/**
 * Closed set of parameter mapping kinds a {@link NodeRule} can declare.
 *
 * Rule kinds are free-form strings in topic files. They are resolved to one of these
 * constants once, when the topic is loaded, so rendering never parses kind strings.
 */
public enum RuleKind {
    /**
     * The positive text prompt
     */
    PROMPT,

    /**
     * {@code params["negative_prompt"]}
     */
    NEGATIVE_PROMPT,

    /**
     * A named text field: {@code text}/{@code string} with a param name,
     * or {@code text:<name>}/{@code string:<name>}
     */
    TEXT,

    /**
     * One already-uploaded input image filename
     */
    INPUT_IMAGE,

    /**
     * A list of uploaded input image filenames, assigned in node order; unused nodes are pruned
     */
    INPUT_IMAGES,

    /**
     * Anything else (model, width, height, steps, seed, fps, length, n, ...).
     * The lower-cased kind string itself is the parameter name.
     */
    SCALAR;

    static final String PROMPT_KIND = "prompt";
    static final String NEGATIVE_PROMPT_KIND = "negative_prompt";
    static final String INPUT_IMAGE_KIND = "input_image";
    static final String INPUT_IMAGES_KIND = "input_images";

    /**
     * Resolve a normalized (trimmed, lower-cased) kind string
     */
    static RuleKind resolve(String kind) {
        switch (kind) {
            case PROMPT_KIND:
                return PROMPT;
            case NEGATIVE_PROMPT_KIND:
                return NEGATIVE_PROMPT;
            case INPUT_IMAGE_KIND:
                return INPUT_IMAGE;
            case INPUT_IMAGES_KIND:
                return INPUT_IMAGES;
            case "text":
            case "string":
                return TEXT;
            default:
                if (kind.startsWith("text:") || kind.startsWith("string:")) {
                    return TEXT;
                }
                return SCALAR;
        }
    }
}

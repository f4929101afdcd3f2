package org.netpreserve.pagecrawl.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.intellij.lang.annotations.Language;

import java.util.List;
import java.util.function.Function;

/**
 * A JavaScript expression evaluated inside a rendered page, with a conversion of its result.
 *
 * @param name   short label used in logs
 * @param script expression evaluated in the page's main world
 * @param reader converts the JSON-like evaluation result (Number, String, Boolean, List, Map or null)
 */
public record Probe<T>(String name, @Language("JavaScript") String script, Function<Object, T> reader) {
    private static final ObjectMapper json = new ObjectMapper();

    /**
     * Number of resource timing entries, grows while the page is still fetching.
     */
    public static final Probe<Integer> RESOURCE_COUNT = new Probe<>("resources",
            "performance.getEntriesByType('resource').length", Probe::toInt);

    /**
     * DOM mutations counted since the document was created.
     */
    public static final Probe<Integer> MUTATION_COUNT = new Probe<>("mutations",
            "window.__pagecrawl ? window.__pagecrawl.mutations : 0", Probe::toInt);

    /**
     * Visible text length of the main content region, or of the body if there isn't one.
     */
    public static final Probe<Integer> CONTENT_LENGTH = new Probe<>("content-length", """
            (function() {
                const main = document.querySelector('main, article, [role="main"], .content, #content');
                const root = main || document.body;
                return root ? root.innerText.length : 0;
            })()
            """, Probe::toInt);

    /**
     * True once every one of the selectors matches an element.
     */
    public static Probe<Boolean> selectorsPresent(List<String> selectors) {
        String array;
        try {
            array = json.writeValueAsString(selectors);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
        return new Probe<>("selectors", array + ".every(s => { try { return document.querySelector(s) !== null; }" +
                                        " catch (e) { return false; } })", Boolean.TRUE::equals);
    }

    private static Integer toInt(Object value) {
        return value instanceof Number number ? number.intValue() : 0;
    }
}

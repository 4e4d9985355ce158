package com.planner.taskservice.application;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.safety.Safelist;
import org.springframework.stereotype.Component;

/**
 * Cleans task descriptions written in the rich text editor before they are stored.
 * <p>
 * Keeps basic formatting, links and images. Scripts, event handlers and any URL that is not
 * http, https or mailto are stripped; disallowed tags are dropped but their text is kept.
 */
@Component
public class RichTextSanitizer {

    static final Safelist SAFELIST = Safelist.none()
            .addTags("p", "br", "strong", "em", "u", "s", "h1", "h2", "h3", "h4", "h5", "h6",
                    "ul", "ol", "li", "blockquote", "code", "pre", "a", "img")
            .addAttributes("a", "href", "title", "target", "rel")
            .addAttributes("img", "src", "alt", "title", "width", "height")
            .addAttributes(":all", "class", "id")
            .addProtocols("a", "href", "http", "https", "mailto")
            .addProtocols("img", "src", "http", "https");

    private static final Document.OutputSettings OUTPUT = new Document.OutputSettings().prettyPrint(false);

    /**
     * @return the cleaned HTML, or the input itself when it is null or empty
     */
    public String sanitize(String html) {
        if (html == null || html.isEmpty()) {
            return html;
        }
        return Jsoup.clean(html, "", SAFELIST, OUTPUT);
    }
}

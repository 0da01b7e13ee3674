package com.contractlink.harvester.harvest.source;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.util.List;

final class HtmlSupport {
    private HtmlSupport() {
    }

    /**
     * Rows matching {@code primary}; when none do, the rows of {@code fallbackTable} that carry data cells.
     */
    static List<Element> rowsOrTable(Document document, String primary, String fallbackTable) {
        Elements rows = document.select(primary);
        if (!rows.isEmpty() || fallbackTable == null) {
            return rows;
        }
        Element table = document.selectFirst(fallbackTable);
        if (table == null) {
            return List.of();
        }
        return table.select("tr:has(td)");
    }

    static String text(Element root, String cssQuery) {
        if (root == null) {
            return null;
        }
        Element element = root.selectFirst(cssQuery);
        return element == null ? null : blankToNull(element.text());
    }

    static String text(Element element) {
        return element == null ? null : blankToNull(element.text());
    }

    /**
     * The title element: the first match of {@code titleQuery}, else the first link.
     */
    static Element titleElement(Element root, String titleQuery) {
        Element title = root.selectFirst(titleQuery);
        return title != null ? title : root.selectFirst("a[href]");
    }

    static String href(Element element) {
        if (element == null) {
            return null;
        }
        Element link = "a".equals(element.normalName()) ? element : element.selectFirst("a[href]");
        return link == null ? null : blankToNull(link.attr("href"));
    }

    static String cell(List<Element> cells, int index) {
        return index >= 0 && index < cells.size() ? text(cells.get(index)) : null;
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}

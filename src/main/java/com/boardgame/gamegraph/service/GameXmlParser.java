package com.boardgame.gamegraph.service;

import com.boardgame.gamegraph.exception.MalformedGameException;
import com.boardgame.gamegraph.model.Game;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Turns a {@code <item>} element of a BGG thing response into a {@link Game}.
 * All validation happens here, so the rest of the pipeline only sees well-formed games.
 */
@Component
@Slf4j
public class GameXmlParser {

    static final String LINK_MECHANIC = "boardgamemechanic";
    static final String LINK_CATEGORY = "boardgamecategory";

    /**
     * Parse one thing item.
     *
     * @param item {@code <item type="boardgame" id="...">} element
     * @return the parsed game
     * @throws MalformedGameException if the item has no id or a numeric field holds a non-number
     */
    public Game parse(Element item) throws MalformedGameException {
        String id = item.attr("id").trim();
        if (id.isEmpty()) {
            throw new MalformedGameException(null, "thing item without id");
        }

        Set<String> mechanics = new LinkedHashSet<>();
        Set<String> categories = new LinkedHashSet<>();
        for (Element link : item.children()) {
            if (!"link".equals(link.tagName())) {
                continue;
            }
            String value = link.attr("value").trim();
            if (value.isEmpty()) {
                continue;
            }
            String type = link.attr("type");
            if (LINK_MECHANIC.equals(type)) {
                mechanics.add(value);
            } else if (LINK_CATEGORY.equals(type)) {
                categories.add(value);
            }
        }

        Element ratings = item.selectFirst("statistics > ratings");

        return Game.builder()
                .id(id)
                .name(primaryName(item))
                .mechanics(mechanics)
                .categories(categories)
                .minPlayers(intValue(id, child(item, "minplayers")))
                .maxPlayers(intValue(id, child(item, "maxplayers")))
                .playingTime(intValue(id, child(item, "playingtime")))
                .averageRating(doubleValue(id, ratings != null ? child(ratings, "average") : null))
                .averageWeight(doubleValue(id, ratings != null ? child(ratings, "averageweight") : null))
                .build();
    }

    /**
     * Primary name if present, otherwise the first name listed, otherwise empty.
     */
    private String primaryName(Element item) {
        String first = null;
        for (Element name : item.children()) {
            if (!"name".equals(name.tagName())) {
                continue;
            }
            String value = name.attr("value").trim();
            if ("primary".equals(name.attr("type")) && !value.isEmpty()) {
                return value;
            }
            if (first == null && !value.isEmpty()) {
                first = value;
            }
        }
        return first != null ? first : "";
    }

    private Element child(Element parent, String tag) {
        for (Element child : parent.children()) {
            if (tag.equals(child.tagName())) {
                return child;
            }
        }
        return null;
    }

    // BGG reports "0" when it has no data for a field, so non-positive values count as unknown.

    private Integer intValue(String id, Element element) throws MalformedGameException {
        String raw = rawValue(element);
        if (raw == null) {
            return null;
        }
        try {
            int value = Integer.parseInt(raw);
            return value > 0 ? value : null;
        } catch (NumberFormatException e) {
            throw new MalformedGameException(id,
                    "non-integer <" + element.tagName() + "> value '" + raw + "'");
        }
    }

    private Double doubleValue(String id, Element element) throws MalformedGameException {
        String raw = rawValue(element);
        if (raw == null) {
            return null;
        }
        try {
            double value = Double.parseDouble(raw);
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new NumberFormatException(raw);
            }
            return value > 0 ? value : null;
        } catch (NumberFormatException e) {
            throw new MalformedGameException(id,
                    "non-numeric <" + element.tagName() + "> value '" + raw + "'");
        }
    }

    private String rawValue(Element element) {
        if (element == null) {
            return null;
        }
        String raw = element.attr("value").trim();
        return raw.isEmpty() ? null : raw;
    }
}

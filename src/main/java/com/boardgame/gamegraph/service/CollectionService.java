package com.boardgame.gamegraph.service;

import com.boardgame.gamegraph.client.BggXmlApiClient;
import com.boardgame.gamegraph.exception.BggApiException;
import com.boardgame.gamegraph.exception.CollectionUnavailableException;
import com.boardgame.gamegraph.model.CollectionEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lists the games a BGG user owns. Expansions are excluded.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CollectionService {

    static final String ENDPOINT = "collection";

    private final BggXmlApiClient apiClient;

    /**
     * Fetch the owned games of a user, deduplicated by id in first-seen order.
     *
     * @param username BGG username
     * @return owned games, possibly empty
     * @throws CollectionUnavailableException if the user or collection cannot be read
     */
    public List<CollectionEntry> fetchCollection(String username) throws CollectionUnavailableException {
        if (username == null || username.isBlank()) {
            throw new CollectionUnavailableException(String.valueOf(username), "username is blank");
        }

        log.info("Fetching collection for user: {}", username);

        Map<String, String> params = new LinkedHashMap<>();
        params.put("username", username);
        params.put("own", "1");
        params.put("excludesubtype", "boardgameexpansion");

        Element root;
        try {
            root = apiClient.request(ENDPOINT, params);
        } catch (BggApiException e) {
            throw new CollectionUnavailableException(username, e.getMessage(), e);
        }

        if ("errors".equals(root.tagName()) || "error".equals(root.tagName())) {
            String message = root.select("message").text();
            throw new CollectionUnavailableException(username,
                    message.isBlank() ? "BGG reported an error" : message);
        }
        if (!"items".equals(root.tagName())) {
            throw new CollectionUnavailableException(username,
                    "unexpected <" + root.tagName() + "> response, expected <items>");
        }

        List<CollectionEntry> entries = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        int duplicates = 0;

        for (Element item : root.children()) {
            if (!"item".equals(item.tagName())) {
                continue;
            }
            String id = item.attr("objectid").trim();
            if (id.isEmpty()) {
                log.debug("Ignoring collection item without objectid");
                continue;
            }
            if (!seen.add(id)) {
                duplicates++;
                continue;
            }
            Element name = item.selectFirst("name");
            entries.add(new CollectionEntry(id, name != null ? name.text().trim() : ""));
        }

        if (duplicates > 0) {
            log.info("Dropped {} duplicate collection entries for {}", duplicates, username);
        }
        log.info("Found {} owned games for {}", entries.size(), username);
        return entries;
    }
}

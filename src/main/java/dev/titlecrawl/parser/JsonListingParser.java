package dev.titlecrawl.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.titlecrawl.model.TitleRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parser for JSON listing documents. The document must contain, at any depth, an item array named
 * {@code edges} or {@code items} and a {@code pageInfo} object carrying a boolean {@code
 * hasNextPage}. Edge entries wrap their title in {@code node} (optionally {@code node.title});
 * plain items are the title object themselves.
 *
 * <pre>
 * {"data": {"search": {
 *   "edges": [{"node": {"titleText": {"text": "Heat"}, "releaseYear": {"year": 1995},
 *              "ratingsSummary": {"aggregateRating": 8.3}}}],
 *   "pageInfo": {"hasNextPage": true}}}}
 * </pre>
 */
public class JsonListingParser implements PageParser {
	private static final Logger logger = LoggerFactory.getLogger(JsonListingParser.class);

	private static final List<String> ITEM_ARRAYS = List.of("edges", "items");

	private final ObjectMapper mapper;

	public JsonListingParser() {
		this(new ObjectMapper());
	}

	public JsonListingParser(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	@Override
	public ParsedPage parse(String payload, PageContext context) throws PageParseException {
		if (payload == null || payload.isBlank()) {
			throw new PageParseException("Empty payload for page " + context.pageIndex());
		}

		JsonNode root;
		try {
			root = mapper.readTree(payload);
		} catch (JsonProcessingException e) {
			throw new PageParseException(
					"Invalid JSON on page " + context.pageIndex() + ": " + e.getOriginalMessage(), e);
		}
		if (root == null || !root.isContainerNode()) {
			throw new PageParseException("Page " + context.pageIndex() + " is not a JSON document");
		}

		JsonNode items = findItemArray(root)
				.orElseThrow(() -> new PageParseException("No item array on page " + context.pageIndex()));
		JsonNode hasNext = findField(root, "pageInfo")
				.map(pageInfo -> pageInfo.get("hasNextPage"))
				.filter(JsonNode::isBoolean)
				.orElseThrow(() -> new PageParseException("No pageInfo.hasNextPage on page " + context.pageIndex()));

		List<TitleRecord> records = new ArrayList<>(items.size());
		int skipped = 0;
		for (JsonNode item : items) {
			TitleRecord record = toRecord(item, context);
			if (record == null) {
				skipped++;
			} else {
				records.add(record);
			}
		}
		if (skipped > 0) {
			logger.debug("Page {}: skipped {} item(s) without a title", context.pageIndex(), skipped);
		}
		return new ParsedPage(records, hasNext.booleanValue(), skipped);
	}

	private static TitleRecord toRecord(JsonNode item, PageContext context) {
		JsonNode titleObj = item.has("node") ? item.get("node") : item;
		if (titleObj.path("title").isObject()) {
			titleObj = titleObj.get("title");
		}
		if (!titleObj.isObject()) {
			return null;
		}

		String title = firstText(titleObj.path("titleText").path("text"), titleObj.path("title"));
		if (title == null || title.isBlank()) {
			return null;
		}
		String year = firstText(titleObj.path("releaseYear").path("year"), titleObj.path("year"));
		String rating = firstText(titleObj.path("ratingsSummary").path("aggregateRating"), titleObj.path("rating"));
		return TitleRecord.of(title, year, rating, context.pageIndex(), context.url(), context.scrapedAt());
	}

	private static String firstText(JsonNode... candidates) {
		for (JsonNode candidate : candidates) {
			if (candidate.isValueNode() && !candidate.isNull()) {
				return candidate.asText();
			}
		}
		return null;
	}

	private static Optional<JsonNode> findItemArray(JsonNode node) {
		if (node.isObject()) {
			for (String name : ITEM_ARRAYS) {
				JsonNode candidate = node.get(name);
				if (candidate != null && candidate.isArray()) {
					return Optional.of(candidate);
				}
			}
		}
		for (JsonNode child : children(node)) {
			Optional<JsonNode> found = findItemArray(child);
			if (found.isPresent()) {
				return found;
			}
		}
		return Optional.empty();
	}

	private static Optional<JsonNode> findField(JsonNode node, String name) {
		if (node.isObject()) {
			JsonNode candidate = node.get(name);
			if (candidate != null && candidate.isObject()) {
				return Optional.of(candidate);
			}
		}
		for (JsonNode child : children(node)) {
			Optional<JsonNode> found = findField(child, name);
			if (found.isPresent()) {
				return found;
			}
		}
		return Optional.empty();
	}

	private static List<JsonNode> children(JsonNode node) {
		List<JsonNode> children = new ArrayList<>();
		if (node.isObject()) {
			for (var it = node.fields(); it.hasNext(); ) {
				Map.Entry<String, JsonNode> entry = it.next();
				if (entry.getValue().isContainerNode()) {
					children.add(entry.getValue());
				}
			}
		} else if (node.isArray()) {
			for (JsonNode element : node) {
				if (element.isContainerNode()) {
					children.add(element);
				}
			}
		}
		return children;
	}
}

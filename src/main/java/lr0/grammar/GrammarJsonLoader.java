package lr0.grammar;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Loads grammars stored as JSON objects:
 *
 * <pre>
 * {
 *   "initial": "S",
 *   "terminals": ["a", "b"],
 *   "nonTerminals": ["S", "A"],
 *   "productions": [
 *     {"left": "S", "right": ["a", "A"]},
 *     {"left": "A", "right": []}
 *   ]
 * }
 * </pre>
 *
 * An empty right hand side or the single symbol "ε" stands for an epsilon production. Additional keys are ignored.
 */
public class GrammarJsonLoader {

	private GrammarJsonLoader(){
	}

	/**
	 * @throws MalformedInputError if the text isn't JSON or a key is missing or has the wrong type
	 */
	public static RawGrammar load(String json){
		JsonElement root;
		try {
			root = JsonParser.parseString(json);
		} catch (JsonParseException ex){
			throw new MalformedInputError("Invalid JSON: " + ex.getMessage(), ex);
		}
		JsonObject grammar = object(root, "The grammar");
		List<RawGrammar.RawProduction> productions = new ArrayList<>();
		JsonArray productionArray = array(member(grammar, "productions", "The grammar"), "\"productions\"");
		for (int i = 0; i < productionArray.size(); i++){
			String context = String.format("Production %d", i);
			JsonObject production = object(productionArray.get(i), context);
			List<String> right = strings(member(production, "right", context), context + " \"right\"");
			if (right.size() == 1 && right.get(0).equals(GrammarDescriptionParser.EPSILON)){
				right = Collections.emptyList();
			}
			productions.add(new RawGrammar.RawProduction(
					string(member(production, "left", context), context + " \"left\""), right));
		}
		return new RawGrammar(string(member(grammar, "initial", "The grammar"), "\"initial\""),
				strings(member(grammar, "terminals", "The grammar"), "\"terminals\""),
				strings(member(grammar, "nonTerminals", "The grammar"), "\"nonTerminals\""),
				productions);
	}

	/**
	 * @throws MalformedInputError if the file isn't JSON or a key is missing or has the wrong type
	 */
	public static RawGrammar load(Path file) throws IOException {
		return load(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
	}

	private static JsonElement member(JsonObject object, String key, String context){
		if (!object.has(key) || object.get(key).isJsonNull()){
			throw new MalformedInputError(String.format("%s has no \"%s\" key", context, key));
		}
		return object.get(key);
	}

	private static JsonObject object(JsonElement element, String context){
		if (!element.isJsonObject()){
			throw new MalformedInputError(String.format("%s has to be a JSON object, got %s", context, element));
		}
		return element.getAsJsonObject();
	}

	private static JsonArray array(JsonElement element, String context){
		if (!element.isJsonArray()){
			throw new MalformedInputError(String.format("%s has to be an array, got %s", context, element));
		}
		return element.getAsJsonArray();
	}

	private static String string(JsonElement element, String context){
		if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()){
			throw new MalformedInputError(String.format("%s has to be a string, got %s", context, element));
		}
		return element.getAsString();
	}

	private static List<String> strings(JsonElement element, String context){
		List<String> strings = new ArrayList<>();
		for (JsonElement entry : array(element, context)){
			strings.add(string(entry, context + " entry"));
		}
		return strings;
	}
}

package org.modfix;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;

public class JsonHelper {
    public static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    /**
     * Reads settings sent by the client. LSP4J hands us Gson trees; anything else is converted first.
     *
     * @throws JsonParseException if the settings don't have the expected shape
     */
    static FixSettings settings(Object json) {
        if (json == null) return new FixSettings();
        var tree = json instanceof JsonElement ? (JsonElement) json : GSON.toJsonTree(json);
        var settings = GSON.fromJson(tree, FixSettings.class);
        if (settings == null) settings = new FixSettings();
        if (settings.modfix == null) settings.modfix = new FixSettings.Modfix();
        if (settings.modfix.logLevel == null) settings.modfix.logLevel = new FixSettings.Modfix().logLevel;
        return settings;
    }
}

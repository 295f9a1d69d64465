package com.example.teausage.storage;

import com.example.teausage.model.MenuEntry;
import com.example.teausage.model.TokenRule;
import com.example.teausage.services.MenuCatalog;
import com.example.teausage.services.TokenResolver;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.*;
import java.nio.file.*;
import java.util.*;

/** JSON reference tables (token rules, menu) and JSON report output. */
public class ReferenceStorage {
    public static final String DEFAULT_TOKEN_RULES = "/defaults/token-rules.json";
    public static final String DEFAULT_MENU = "/defaults/menu.json";

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .registerModule(new JavaTimeModule());

    /** Menu file layout. */
    public static class Menu {
        public List<MenuEntry> items = new ArrayList<>();
        public Map<String, Map<String, Double>> namedBlends = new LinkedHashMap<>();
    }

    public List<TokenRule> loadTokenRules(InputStream in) throws IOException {
        try {
            return mapper.readValue(in, new TypeReference<List<TokenRule>>() {});
        } catch (IOException ex) {
            throw new IOException("Failed to parse token rules JSON. Expect an array of {pattern, match, kind, value}.", ex);
        }
    }

    public Menu loadMenu(InputStream in) throws IOException {
        try {
            Menu m = mapper.readValue(in, Menu.class);
            if (m == null) throw new IOException("Menu JSON is empty");
            return m;
        } catch (IOException ex) {
            throw new IOException("Failed to parse menu JSON. Expect { items: [..], namedBlends: { name: { component: weight } } }", ex);
        }
    }

    public TokenResolver tokenResolver(Path file) throws IOException {
        try (InputStream in = open(file, DEFAULT_TOKEN_RULES)) {
            return new TokenResolver(loadTokenRules(in));
        }
    }

    public MenuCatalog menuCatalog(Path file) throws IOException {
        try (InputStream in = open(file, DEFAULT_MENU)) {
            Menu m = loadMenu(in);
            return new MenuCatalog(m.items, m.namedBlends);
        }
    }

    public void writeJson(Object value, Path file) throws IOException {
        mapper.writeValue(file.toFile(), value);
    }

    /** The given file, or the packaged default when {@code file} is null. */
    static InputStream open(Path file, String resource) throws IOException {
        if (file != null) return Files.newInputStream(file);
        InputStream in = ReferenceStorage.class.getResourceAsStream(resource);
        if (in == null) throw new FileNotFoundException("Missing classpath resource " + resource);
        return in;
    }
}

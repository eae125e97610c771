package com.charlib.tool.parser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.charlib.tool.exception.SourceReadException;
import com.charlib.tool.tree.LibertyTree;
import com.charlib.tool.tree.TreeEngine;
import com.charlib.tool.tree.node.GroupNode;

/**
 * {@link TreeEngine} that reads Liberty text files into an in-memory tree.
 */
public class TextTreeEngine implements TreeEngine {
    private static final Logger log = LoggerFactory.getLogger(TextTreeEngine.class);

    @Override
    public LibertyTree open(Path source) {
        if (!Files.isRegularFile(source)) {
            throw new SourceReadException(source, "file does not exist or is not a regular file");
        }

        String content;
        try {
            content = Files.readString(source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SourceReadException(source, e.getMessage(), e);
        }

        String fileName = source.getFileName().toString();
        log.info("Parsing Liberty source: {}", fileName);

        List<GroupNode> topGroups = parse(content, fileName);
        return new TextLibertyTree(source, topGroups);
    }

    /**
     * Parses Liberty text without touching the file system.
     */
    public static List<GroupNode> parse(String content, String fileName) {
        LibertyTokenizer tokenizer = new LibertyTokenizer(content, fileName);
        List<LibertyToken> tokens = tokenizer.tokenize();

        LibertyParser parser = new LibertyParser(tokens, content, fileName);
        return parser.parse();
    }
}

package com.williamcallahan.markdownlabel.service.serialize;

import com.williamcallahan.markdownlabel.domain.ast.MarkdownToken;
import com.williamcallahan.markdownlabel.domain.reference.ReferenceTable;
import com.williamcallahan.markdownlabel.service.render.ReferenceResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Writes a token tree back to Markdown source that parses to the same tree.
 *
 * <p>Blocks are separated by one blank line. Links and images whose resolved URL occurs
 * more than once are written reference-style, and their definitions are appended once after
 * all blocks. Stateless; every call uses fresh writers.</p>
 */
public final class MarkdownSerializer {

    private static final Logger logger = LoggerFactory.getLogger(MarkdownSerializer.class);

    /**
     * Serializes tokens whose links all carry explicit URLs.
     * @param tokens top-level block tokens
     * @return Markdown source
     */
    public String serialize(List<MarkdownToken> tokens) {
        return serialize(tokens, ReferenceTable.empty());
    }

    /**
     * Serializes tokens, resolving reference-style links against {@code references}.
     *
     * @param tokens top-level block tokens
     * @param references definitions collected when the tokens were parsed
     * @return Markdown source
     */
    public String serialize(List<MarkdownToken> tokens, ReferenceTable references) {
        if (tokens == null || tokens.isEmpty()) {
            return "";
        }
        ReferenceResolver resolver = new ReferenceResolver(references);
        ReferenceDeduplicator deduplicator = ReferenceDeduplicator.collect(tokens, resolver);
        BlockMarkdownWriter blockWriter = new BlockMarkdownWriter(new InlineMarkdownWriter(resolver, deduplicator));

        String body = blockWriter.joinBlocks(tokens, BlockMarkdownWriter.BLOCK_SEPARATOR);
        List<String> definitions = deduplicator.definitionLines();
        logger.debug("Serialized {} block tokens with {} shared reference definitions",
            tokens.size(), definitions.size());
        if (definitions.isEmpty()) {
            return body;
        }
        String definitionBlock = String.join("\n", definitions);
        return body.isEmpty() ? definitionBlock : body + BlockMarkdownWriter.BLOCK_SEPARATOR + definitionBlock;
    }
}

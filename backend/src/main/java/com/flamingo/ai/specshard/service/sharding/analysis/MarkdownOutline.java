package com.flamingo.ai.specshard.service.sharding.analysis;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.Code;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.Heading;
import org.commonmark.node.Node;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.SourceSpan;
import org.commonmark.node.Text;
import org.commonmark.parser.IncludeSourceSpans;
import org.commonmark.parser.Parser;

/**
 * Line-indexed view of a Markdown document built from the {@code commonmark-java} AST.
 *
 * <p>Block source spans tie every ATX {@link Heading} and {@link FencedCodeBlock} back to the
 * lines it came from, so line-oriented callers can tell a real heading from a {@code ## comment}
 * inside a code fence. Only top-level-looking ATX headings (the line itself starts with {@code #})
 * are reported; setext headings and headings nested in quotes or list items are ignored.
 *
 * <p>Lines are split on {@code \n}, {@code \r\n} and {@code \r}, the same way the parser counts
 * them.
 */
public final class MarkdownOutline {

  private static final Parser PARSER =
      Parser.builder().includeSourceSpans(IncludeSourceSpans.BLOCKS).build();

  private final List<String> lines;
  private final Map<Integer, HeadingLine> headingsByLine;
  private final List<HeadingLine> headings;
  private final BitSet codeLines;

  private MarkdownOutline(List<String> lines, List<HeadingLine> headings, BitSet codeLines) {
    this.lines = lines;
    this.headings = List.copyOf(headings);
    this.codeLines = codeLines;
    this.headingsByLine = new HashMap<>();
    for (HeadingLine heading : headings) {
      headingsByLine.put(heading.line(), heading);
    }
  }

  /**
   * Parses the given text.
   *
   * @param text Markdown source; {@code null} is treated as empty
   * @return outline of the text
   */
  public static MarkdownOutline parse(String text) {
    String source = text == null ? "" : text;
    List<String> lines = List.of(SpecPatterns.lines(source));
    OutlineVisitor visitor = new OutlineVisitor(lines);
    PARSER.parse(source).accept(visitor);
    return new MarkdownOutline(lines, visitor.headings, visitor.codeLines);
  }

  public List<String> lines() {
    return lines;
  }

  /** ATX headings in document order. */
  public List<HeadingLine> headings() {
    return headings;
  }

  /** Returns the heading that starts on the given line, or {@code null}. */
  public HeadingLine headingAt(int line) {
    return headingsByLine.get(line);
  }

  /** Returns the heading level on the given line, or 0 when the line is not an ATX heading. */
  public int headingLevel(int line) {
    HeadingLine heading = headingsByLine.get(line);
    return heading == null ? 0 : heading.level();
  }

  /** Whether the line belongs to a fenced code block, fences included. */
  public boolean isCode(int line) {
    return codeLines.get(line);
  }

  /** Number of characters on code lines, counting the line break after each but the last. */
  public int codeLength() {
    int length = 0;
    for (int i = codeLines.nextSetBit(0); i >= 0; i = codeLines.nextSetBit(i + 1)) {
      length += lines.get(i).length();
      if (i < lines.size() - 1) {
        length++;
      }
    }
    return length;
  }

  /**
   * An ATX heading.
   *
   * @param line zero-based line index
   * @param level heading level, 1 to 6
   * @param title inline text of the heading
   */
  public record HeadingLine(int line, int level, String title) {}

  private static final class OutlineVisitor extends AbstractVisitor {

    private final List<String> lines;
    private final List<HeadingLine> headings = new ArrayList<>();
    private final BitSet codeLines = new BitSet();

    private OutlineVisitor(List<String> lines) {
      this.lines = lines;
    }

    @Override
    public void visit(Heading heading) {
      List<SourceSpan> spans = heading.getSourceSpans();
      if (spans.isEmpty()) {
        return;
      }
      int line = spans.get(0).getLineIndex();
      if (line >= lines.size() || !lines.get(line).strip().startsWith("#")) {
        return;
      }
      String title = extractText(heading);
      if (!title.isBlank()) {
        headings.add(new HeadingLine(line, heading.getLevel(), title));
      }
    }

    @Override
    public void visit(FencedCodeBlock codeBlock) {
      List<SourceSpan> spans = codeBlock.getSourceSpans();
      if (spans.isEmpty()) {
        return;
      }
      int first = spans.get(0).getLineIndex();
      int last = spans.get(spans.size() - 1).getLineIndex();
      codeLines.set(first, Math.min(last, lines.size() - 1) + 1);
    }

    private static String extractText(Node node) {
      StringBuilder sb = new StringBuilder();
      collectNodeText(node, sb);
      return sb.toString().trim();
    }

    private static void collectNodeText(Node node, StringBuilder sb) {
      if (node instanceof Text textNode) {
        sb.append(textNode.getLiteral());
      } else if (node instanceof Code code) {
        sb.append(code.getLiteral());
      } else if (node instanceof SoftLineBreak) {
        sb.append(" ");
      } else {
        Node child = node.getFirstChild();
        while (child != null) {
          collectNodeText(child, sb);
          child = child.getNext();
        }
      }
    }
  }
}

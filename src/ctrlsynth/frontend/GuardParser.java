package ctrlsynth.frontend;

import ctrlsynth.ir.Assignment;
import ctrlsynth.ir.Guard;
import ctrlsynth.ir.Port;
import ctrlsynth.ir.Source;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses the textual forms of ports, sources, guards and assignments used in program files.
 * <pre>
 * assignment := port '=' [guard '?'] source [';']
 * guard      := and ('|' and)*
 * and        := unary ('&amp;' unary)*
 * unary      := '!' unary | '(' guard ')' | '1' | '0' | 'true' | 'false' | port
 * port       := cell '.' name | 'this' '.' name | owner '[' hole ']'
 * source     := number | width "'d" number | port
 * </pre>
 */
public class GuardParser {
  private final String text;
  private final List<String> tokens;
  private int pos;

  private GuardParser(String text) throws ProgramFormatException {
    this.text = text;
    this.tokens = tokenize(text);
  }

  public static Guard parseGuard(String text) throws ProgramFormatException {
    GuardParser parser = new GuardParser(text);
    Guard ret = parser.guard();
    parser.expectEnd();
    return ret;
  }

  public static Port parsePort(String text) throws ProgramFormatException {
    GuardParser parser = new GuardParser(text);
    Port ret = parser.port();
    parser.expectEnd();
    return ret;
  }

  public static Source parseSource(String text) throws ProgramFormatException {
    GuardParser parser = new GuardParser(text);
    Source ret = parser.source();
    parser.expectEnd();
    return ret;
  }

  public static Assignment parseAssignment(String text) throws ProgramFormatException {
    GuardParser parser = new GuardParser(text);
    Port dest = parser.port();
    parser.expect("=");
    int questionMark = parser.tokens.indexOf("?");
    Guard guard = Guard.TRUE;
    if (questionMark >= 0) {
      guard = parser.guard();
      parser.expect("?");
    }
    Source source = parser.source();
    if (";".equals(parser.peek()))
      ++parser.pos;
    parser.expectEnd();
    return new Assignment(dest, guard, source);
  }

  private static List<String> tokenize(String text) throws ProgramFormatException {
    List<String> ret = new ArrayList<>();
    int i = 0;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (Character.isWhitespace(c)) {
        ++i;
      } else if (Character.isLetterOrDigit(c) || c == '_') {
        int start = i;
        while (i < text.length() && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_' || text.charAt(i) == '\''))
          ++i;
        ret.add(text.substring(start, i));
      } else if ("!&|()[].=?;".indexOf(c) >= 0) {
        ret.add(String.valueOf(c));
        ++i;
      } else {
        throw new ProgramFormatException("Unexpected character '" + c + "' in \"" + text + "\"");
      }
    }
    return ret;
  }

  private String peek() { return (pos < tokens.size()) ? tokens.get(pos) : null; }

  private String next() throws ProgramFormatException {
    if (pos >= tokens.size())
      throw new ProgramFormatException("Unexpected end of \"" + text + "\"");
    return tokens.get(pos++);
  }

  private void expect(String token) throws ProgramFormatException {
    String got = next();
    if (!got.equals(token))
      throw new ProgramFormatException("Expected '" + token + "' but found '" + got + "' in \"" + text + "\"");
  }

  private void expectEnd() throws ProgramFormatException {
    if (pos < tokens.size())
      throw new ProgramFormatException("Trailing '" + tokens.get(pos) + "' in \"" + text + "\"");
  }

  private Guard guard() throws ProgramFormatException {
    Guard ret = conjunction();
    while ("|".equals(peek())) {
      ++pos;
      ret = ret.or(conjunction());
    }
    return ret;
  }

  private Guard conjunction() throws ProgramFormatException {
    Guard ret = unary();
    while ("&".equals(peek())) {
      ++pos;
      ret = ret.and(unary());
    }
    return ret;
  }

  private Guard unary() throws ProgramFormatException {
    String token = peek();
    if (token == null)
      throw new ProgramFormatException("Unexpected end of \"" + text + "\"");
    switch (token) {
    case "!":
      ++pos;
      return unary().not();
    case "(": {
      ++pos;
      Guard ret = guard();
      expect(")");
      return ret;
    }
    case "1":
    case "true":
      ++pos;
      return Guard.TRUE;
    case "0":
    case "false":
      ++pos;
      return Guard.FALSE;
    default:
      return Guard.port(port());
    }
  }

  private Port port() throws ProgramFormatException {
    String owner = next();
    if (!isIdentifier(owner))
      throw new ProgramFormatException("Expected a port but found '" + owner + "' in \"" + text + "\"");
    String separator = next();
    if (separator.equals(".")) {
      String name = identifier();
      return owner.equals(Port.COMPONENT_OWNER) ? Port.component(name) : Port.cell(owner, name);
    }
    if (separator.equals("[")) {
      String hole = identifier();
      expect("]");
      return Port.hole(owner, hole);
    }
    throw new ProgramFormatException("Expected '.' or '[' after " + owner + " in \"" + text + "\"");
  }

  private String identifier() throws ProgramFormatException {
    String ret = next();
    if (!isIdentifier(ret))
      throw new ProgramFormatException("Expected a name but found '" + ret + "' in \"" + text + "\"");
    return ret;
  }

  private Source source() throws ProgramFormatException {
    String token = peek();
    if (token != null && Character.isDigit(token.charAt(0))) {
      ++pos;
      return constant(token);
    }
    return Source.of(port());
  }

  private Source constant(String token) throws ProgramFormatException {
    try {
      int tick = token.indexOf("'d");
      if (tick >= 0)
        return Source.constant(Long.parseLong(token.substring(tick + 2)), Integer.parseInt(token.substring(0, tick)));
      long value = Long.parseLong(token);
      return Source.constant(value, (value == 0 || value == 1) ? 1 : 32);
    } catch (IllegalArgumentException e) {
      throw new ProgramFormatException("Bad constant '" + token + "' in \"" + text + "\"", e);
    }
  }

  private static boolean isIdentifier(String token) {
    return (Character.isLetter(token.charAt(0)) || token.charAt(0) == '_') && token.indexOf('\'') < 0;
  }
}

package io.kvchain.core.parser;

import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.events.Event;

/**
 * Invalid chain definition. When the problem can be tied to a YAML node the message starts with
 * <code>line L, column C: </code> and the position is available through {@link #line()} and {@link #column()}.
 */
public class ParserException extends Exception {
   private final int line;
   private final int column;

   public ParserException(String msg) {
      this(msg, null);
   }

   public ParserException(String msg, Throwable cause) {
      super(msg, cause);
      this.line = -1;
      this.column = -1;
   }

   public ParserException(Event event, String msg) {
      this(event, msg, null);
   }

   public ParserException(Event event, String msg, Throwable cause) {
      this(event.getStartMark(), msg, cause);
   }

   private ParserException(Mark mark, String msg, Throwable cause) {
      super("line " + (mark.getLine() + 1) + ", column " + (mark.getColumn() + 1) + ": " + msg, cause);
      this.line = mark.getLine() + 1;
      this.column = mark.getColumn() + 1;
   }

   /**
    * @return 1-based line of the offending node or -1 when unknown.
    */
   public int line() {
      return line;
   }

   public int column() {
      return column;
   }
}

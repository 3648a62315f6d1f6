package io.kvchain.core.generators;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

import io.kvchain.api.config.ChainDefinitionException;
import io.kvchain.api.session.Session;
import io.kvchain.function.SerializableFunction;

/**
 * String interpolation replacing <code>${var}</code> with the value of session variable <code>var</code>.
 * Use <code>$${</code> to produce a literal <code>${</code>.
 */
public class Pattern implements SerializableFunction<Session, String> {
   private static final int VAR_LENGTH_ESTIMATE = 16;
   private final Component[] components;
   private final int lengthEstimate;

   public Pattern(String str) {
      List<Component> components = new ArrayList<>();
      StringBuilder literal = new StringBuilder();
      int estimate = 0;
      int i = 0;
      while (i < str.length()) {
         if (str.startsWith("$${", i)) {
            literal.append("${");
            i += 3;
         } else if (str.startsWith("${", i)) {
            int close = str.indexOf('}', i + 2);
            if (close < 0) {
               throw new ChainDefinitionException("Missing closing brace (}) in '" + str + "'");
            }
            String var = str.substring(i + 2, close).trim();
            if (var.isEmpty()) {
               throw new ChainDefinitionException("Empty variable name in '" + str + "'");
            }
            if (literal.length() > 0) {
               components.add(new Literal(literal.toString()));
               estimate += literal.length();
               literal.setLength(0);
            }
            components.add(new Variable(var));
            estimate += VAR_LENGTH_ESTIMATE;
            i = close + 1;
         } else {
            literal.append(str.charAt(i++));
         }
      }
      if (literal.length() > 0) {
         components.add(new Literal(literal.toString()));
         estimate += literal.length();
      }
      this.components = components.toArray(new Component[0]);
      this.lengthEstimate = estimate;
   }

   /**
    * @param str Pattern string.
    * @return Name of the variable if the whole pattern is a single <code>${var}</code> reference, otherwise <code>null</code>.
    */
   public static String singleVariable(String str) {
      String trimmed = str.trim();
      if (trimmed.startsWith("${") && trimmed.indexOf('}') == trimmed.length() - 1) {
         String var = trimmed.substring(2, trimmed.length() - 1).trim();
         return var.isEmpty() ? null : var;
      }
      return null;
   }

   public boolean isConstant() {
      for (Component component : components) {
         if (component instanceof Variable) {
            return false;
         }
      }
      return true;
   }

   @Override
   public String apply(Session session) {
      if (components.length == 0) {
         return "";
      } else if (components.length == 1 && components[0] instanceof Literal) {
         return ((Literal) components[0]).text;
      }
      StringBuilder sb = new StringBuilder(lengthEstimate);
      for (Component c : components) {
         c.appendTo(session, sb);
      }
      return sb.toString();
   }

   private interface Component extends Serializable {
      void appendTo(Session session, StringBuilder sb);
   }

   private static class Literal implements Component {
      private final String text;

      Literal(String text) {
         this.text = text;
      }

      @Override
      public void appendTo(Session session, StringBuilder sb) {
         sb.append(text);
      }
   }

   private static class Variable implements Component {
      private final String name;

      Variable(String name) {
         this.name = name;
      }

      @Override
      public void appendTo(Session session, StringBuilder sb) {
         Object value = session.attribute(name)
               .orElseThrow(() -> new IllegalArgumentException("Variable " + name + " is not set!"));
         sb.append(value);
      }
   }
}

package io.kvchain.core.generators;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.kvchain.api.session.Session;
import io.kvchain.function.SerializableFunction;

/**
 * Factories for the functions that compute keys and values of cache operations from the session.
 */
public final class ObjectSource {
   private ObjectSource() {}

   /**
    * Strings are interpreted as patterns: <code>${var}</code> alone reads the variable keeping its type,
    * a string mixing text and variables is interpolated, anything else is a constant.
    * Collections and maps are resolved element by element; sets stay sets, any other collection becomes a list.
    *
    * @param value Constant, pattern, collection or map.
    * @return Function producing the value.
    */
   public static SerializableFunction<Session, Object> of(Object value) {
      if (value instanceof String) {
         return pattern((String) value);
      } else if (value instanceof Map) {
         Map<SerializableFunction<Session, Object>, SerializableFunction<Session, Object>> sources = new LinkedHashMap<>();
         ((Map<?, ?>) value).forEach((k, v) -> sources.put(of(k), of(v)));
         return new MapSource(sources);
      } else if (value instanceof Collection) {
         List<SerializableFunction<Session, Object>> sources = new ArrayList<>();
         for (Object item : (Collection<?>) value) {
            sources.add(of(item));
         }
         return new CollectionSource(sources, value instanceof Set);
      } else {
         return new Constant(value);
      }
   }

   public static SerializableFunction<Session, Object> pattern(String pattern) {
      String var = Pattern.singleVariable(pattern);
      if (var != null) {
         return fromVar(var);
      }
      Pattern p = new Pattern(pattern);
      return p.isConstant() ? new Constant(p.apply(null)) : p::apply;
   }

   public static SerializableFunction<Session, Object> fromVar(String var) {
      return new VarSource(var);
   }

   private static class Constant implements SerializableFunction<Session, Object> {
      private final Object value;

      private Constant(Object value) {
         this.value = value;
      }

      @Override
      public Object apply(Session session) {
         return value;
      }
   }

   private static class VarSource implements SerializableFunction<Session, Object> {
      private final String var;

      private VarSource(String var) {
         this.var = var;
      }

      @Override
      public Object apply(Session session) {
         return session.attribute(var).orElseThrow(() -> new IllegalArgumentException("Variable " + var + " is not set!"));
      }
   }

   private static class CollectionSource implements SerializableFunction<Session, Object> {
      private final List<SerializableFunction<Session, Object>> sources;
      private final boolean set;

      private CollectionSource(List<SerializableFunction<Session, Object>> sources, boolean set) {
         this.sources = sources;
         this.set = set;
      }

      @Override
      public Object apply(Session session) {
         Collection<Object> values = set ? new LinkedHashSet<>() : new ArrayList<>(sources.size());
         for (SerializableFunction<Session, Object> source : sources) {
            values.add(source.apply(session));
         }
         return values;
      }
   }

   private static class MapSource implements SerializableFunction<Session, Object> {
      private final Map<SerializableFunction<Session, Object>, SerializableFunction<Session, Object>> sources;

      private MapSource(Map<SerializableFunction<Session, Object>, SerializableFunction<Session, Object>> sources) {
         this.sources = sources;
      }

      @Override
      public Object apply(Session session) {
         Map<Object, Object> map = new LinkedHashMap<>();
         sources.forEach((k, v) -> map.put(k.apply(session), v.apply(session)));
         return map;
      }
   }
}

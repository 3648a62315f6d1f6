package io.kvchain.api.session;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

public class SessionTest {

   @Test
   public void testUpdatesDoNotModifyOriginal() {
      Session original = Session.create(3, "scenario");
      Session updated = original.setAttribute("foo", "bar").set(SessionKey.EXPLICIT_LOCK, true);

      assertThat(original.attribute("foo")).isEmpty();
      assertThat(original.explicitLocksUsed()).isEmpty();
      assertThat(updated.attribute("foo")).contains("bar");
      assertThat(updated.explicitLocksUsed()).contains(true);
      assertThat(updated.userId()).isEqualTo(3);
      assertThat(updated.scenario()).isEqualTo("scenario");
   }

   @Test
   public void testSettingNullRemoves() {
      Session session = Session.create(0, "s").setAttribute("foo", 1);
      assertThat(session.contains(SessionKey.saved("foo"))).isTrue();

      Session cleared = session.setAttribute("foo", null);
      assertThat(cleared.contains(SessionKey.saved("foo"))).isFalse();
      assertThat(cleared.removeAttribute("foo")).isSameAs(cleared);
   }

   @Test
   public void testAttributesExcludeReservedSlots() {
      Map<String, Object> values = new HashMap<>();
      values.put("a", 1);
      values.put("b", "two");
      values.put("c", null);
      Session session = Session.create(0, "s")
            .set(SessionKey.EXPLICIT_LOCK, false)
            .setAttribute("c", 3)
            .setAttributes(values);

      assertThat(session.attributes()).containsOnly(Map.entry("a", 1), Map.entry("b", "two"));
      assertThat(session.explicitLocksUsed()).contains(false);
   }

   @Test
   public void testSavedNameDoesNotClashWithReservedSlot() {
      Session session = Session.create(0, "s").setAttribute("client", "not a client");
      assertThat(session.client()).isEmpty();
      assertThat(session.attribute("client")).contains("not a client");
   }
}

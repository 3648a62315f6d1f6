package io.kvchain.core.chain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

import io.kvchain.api.config.ChainDefinitionException;
import io.kvchain.api.session.Action;
import io.kvchain.core.actions.cache.CacheOperation;
import io.kvchain.core.actions.cache.CacheRequestAction;
import io.kvchain.core.actions.cache.CreateCacheAction;
import io.kvchain.core.actions.cache.LockAction;
import io.kvchain.core.actions.cache.UnlockAction;
import io.kvchain.core.actions.client.ClientCloseAction;
import io.kvchain.core.actions.client.ClientStartAction;
import io.kvchain.core.actions.tx.TransactionCloseAction;
import io.kvchain.core.actions.tx.TransactionEndAction;
import io.kvchain.core.actions.tx.TransactionStartAction;
import io.kvchain.core.protocol.KvProtocol;

/**
 * Composes actions, groups and transaction scopes into a {@link Chain}.
 * <pre>
 * Chain chain = ChainBuilder.chain("transfer")
 *       .transaction().concurrency(PESSIMISTIC).run(tx -&gt; tx
 *             .getAndPut("accounts").key(1).value(100).end()
 *             .commit())
 *       .get("accounts").key(1).check(Checks.entries().count().is(1)).end()
 *       .build(protocol);
 * </pre>
 */
public class ChainBuilder {
   private final String name;
   private final List<Element> elements = new ArrayList<>();

   ChainBuilder(String name) {
      this.name = name;
   }

   public static ChainBuilder chain(String name) {
      return new ChainBuilder(Objects.requireNonNull(name));
   }

   public String name() {
      return name;
   }

   public CacheRequestAction.Builder request(CacheOperation operation, String cacheName) {
      CacheRequestAction.Builder builder = new CacheRequestAction.Builder(this, operation, cacheName);
      action(builder);
      return builder;
   }

   public CacheRequestAction.Builder put(String cacheName) {
      return request(CacheOperation.PUT, cacheName);
   }

   public CacheRequestAction.Builder putAll(String cacheName) {
      return request(CacheOperation.PUT_ALL, cacheName);
   }

   public CacheRequestAction.Builder get(String cacheName) {
      return request(CacheOperation.GET, cacheName);
   }

   public CacheRequestAction.Builder getAll(String cacheName) {
      return request(CacheOperation.GET_ALL, cacheName);
   }

   public CacheRequestAction.Builder getAndPut(String cacheName) {
      return request(CacheOperation.GET_AND_PUT, cacheName);
   }

   public CacheRequestAction.Builder getAndRemove(String cacheName) {
      return request(CacheOperation.GET_AND_REMOVE, cacheName);
   }

   public CacheRequestAction.Builder remove(String cacheName) {
      return request(CacheOperation.REMOVE, cacheName);
   }

   public CacheRequestAction.Builder removeAll(String cacheName) {
      return request(CacheOperation.REMOVE_ALL, cacheName);
   }

   public CacheRequestAction.Builder invoke(String cacheName) {
      return request(CacheOperation.INVOKE, cacheName);
   }

   public LockAction.Builder lock(String cacheName) {
      LockAction.Builder builder = new LockAction.Builder(this, cacheName);
      action(builder);
      return builder;
   }

   /**
    * Releases lock saved in the default <code>lock</code> variable.
    *
    * @return Self.
    */
   public ChainBuilder unlock() {
      return unlock("lock");
   }

   public ChainBuilder unlock(String var) {
      return action(new UnlockAction.Builder(this).lock(var));
   }

   public CreateCacheAction.Builder createCache(String cacheName) {
      CreateCacheAction.Builder builder = new CreateCacheAction.Builder(this, cacheName);
      action(builder);
      return builder;
   }

   public TransactionStartAction.Builder txStart() {
      TransactionStartAction.Builder builder = new TransactionStartAction.Builder(this);
      action(builder);
      return builder;
   }

   public ChainBuilder commit() {
      return action(new TransactionEndAction.Builder(TransactionEndAction.Kind.COMMIT));
   }

   public ChainBuilder rollback() {
      return action(new TransactionEndAction.Builder(TransactionEndAction.Kind.ROLLBACK));
   }

   public ChainBuilder txClose() {
      return action(new TransactionCloseAction.Builder());
   }

   public ChainBuilder startClient() {
      return action(new ClientStartAction.Builder());
   }

   public ChainBuilder closeClient() {
      return action(new ClientCloseAction.Builder());
   }

   public ChainBuilder action(ActionBuilder builder) {
      elements.add(new ActionElement(builder));
      return this;
   }

   /**
    * Actions in the group are recorded with the group name as a prefix.
    *
    * @param groupName Group name.
    * @param body Consumer adding actions to the group.
    * @return Self.
    */
   public ChainBuilder group(String groupName, Consumer<ChainBuilder> body) {
      ChainBuilder group = new ChainBuilder(groupName);
      body.accept(group);
      return group(groupName, group);
   }

   public ChainBuilder group(String groupName, ChainBuilder body) {
      if (groupName == null || groupName.isEmpty()) {
         throw new ChainDefinitionException(name, "group name must not be empty");
      }
      elements.add(new GroupElement(groupName, body));
      return this;
   }

   /**
    * Starts definition of a transaction scope: the body runs in a transaction which is always
    * closed afterwards, even if an action in the body fails.
    *
    * @return Builder of the scope; finish it with {@link TransactionScopeBuilder#run(Consumer)}
    *       or {@link TransactionScopeBuilder#end()}.
    */
   public TransactionScopeBuilder transaction() {
      return new TransactionScopeBuilder(this);
   }

   void addScope(TransactionScopeBuilder scope) {
      elements.add(new ScopeElement(scope));
   }

   public Chain build(KvProtocol protocol) {
      return build(name, protocol);
   }

   /**
    * @param chainName Name of the built chain.
    * @param protocol Protocol used by the sessions.
    * @return Chain.
    * @throws ChainDefinitionException if any action is not defined correctly.
    */
   public Chain build(String chainName, KvProtocol protocol) {
      ChainContext context = new ChainContext(chainName, protocol);
      List<ChainStep> steps = new ArrayList<>();
      compile(context, "", steps, false);
      if (steps.isEmpty()) {
         throw new ChainDefinitionException(chainName, "chain has no actions");
      }
      return new Chain(chainName, protocol, steps);
   }

   void compile(ChainContext context, String prefix, List<ChainStep> steps, boolean inTransactionScope) {
      for (Element element : elements) {
         element.compile(context, prefix, steps, inTransactionScope);
      }
   }

   private interface Element {
      void compile(ChainContext context, String prefix, List<ChainStep> steps, boolean inTransactionScope);
   }

   private static class ActionElement implements Element {
      private final ActionBuilder builder;

      ActionElement(ActionBuilder builder) {
         this.builder = builder;
      }

      @Override
      public void compile(ChainContext context, String prefix, List<ChainStep> steps, boolean inTransactionScope) {
         Action action = builder.build(context);
         steps.add(new ChainStep(action, prefix + action.name(), -1));
      }
   }

   private static class GroupElement implements Element {
      private final String name;
      private final ChainBuilder body;

      GroupElement(String name, ChainBuilder body) {
         this.name = name;
         this.body = body;
      }

      @Override
      public void compile(ChainContext context, String prefix, List<ChainStep> steps, boolean inTransactionScope) {
         body.compile(context, prefix + name + " / ", steps, inTransactionScope);
      }
   }

   private static class ScopeElement implements Element {
      private final TransactionScopeBuilder scope;

      ScopeElement(TransactionScopeBuilder scope) {
         this.scope = scope;
      }

      @Override
      public void compile(ChainContext context, String prefix, List<ChainStep> steps, boolean inTransactionScope) {
         if (inTransactionScope) {
            throw new ChainDefinitionException(context.chainName(), "transaction scopes can not be nested");
         }
         String scopePrefix = scope.name() == null ? prefix : prefix + scope.name() + " / ";
         int start = steps.size();
         Action begin = scope.begin().build(context);
         steps.add(new ChainStep(begin, scopePrefix + begin.name(), -1));
         scope.body().compile(context, scopePrefix, steps, true);
         Action close = new TransactionCloseAction.Builder().build(context);
         steps.add(new ChainStep(close, scopePrefix + close.name(), start));
      }
   }
}

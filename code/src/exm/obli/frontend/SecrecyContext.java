/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.obli.frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.obli.common.Logging;

/**
 * Tracks which variable names hold secret-derived values during one
 * transformation run.
 *
 * A scoped context is a chain of scopes: a lookup walks from the
 * innermost scope outwards, and a mark only ever goes into the scope it
 * is made in, so it disappears once the walker leaves that scope.
 * A flat context ignores scopes: every mark is visible for the rest of
 * the run, including in sibling branches visited later.
 *
 * Within a scope, marks are never removed.
 */
public class SecrecyContext {

  private static final Logger logger = Logging.getObliLogger();

  private final SecrecyContext parent;
  private final Set<String> secretVars;
  private final boolean scoped;
  private final int depth;

  private SecrecyContext(SecrecyContext parent, boolean scoped) {
    this.parent = parent;
    this.secretVars = new HashSet<String>();
    this.scoped = scoped;
    this.depth = parent == null ? 0 : parent.depth + 1;
  }

  /**
   * @return new empty context with lexical scoping
   */
  public static SecrecyContext createScoped() {
    return new SecrecyContext(null, true);
  }

  /**
   * @return new empty context with a single set for the whole run
   */
  public static SecrecyContext createFlat() {
    return new SecrecyContext(null, false);
  }

  public static SecrecyContext create(boolean scoped) {
    return scoped ? createScoped() : createFlat();
  }

  /**
   * Open a nested scope, e.g. for a let body or a branch.
   * @return a child scope, or this context if it is flat
   */
  public SecrecyContext enterScope() {
    if (!scoped) {
      return this;
    }
    return new SecrecyContext(this, true);
  }

  /**
   * Record that name holds a secret value in this scope.  Idempotent.
   */
  public void markSecret(String name) {
    if (secretVars.add(name) && logger.isDebugEnabled()) {
      logger.debug("Marked " + name + " secret at scope depth " + depth);
    }
  }

  /**
   * @return true if name was marked secret in this scope or an
   *         enclosing one; false for unknown names
   */
  public boolean isSecret(String name) {
    SecrecyContext curr = this;
    while (curr != null) {
      if (curr.secretVars.contains(name)) {
        return true;
      }
      curr = curr.parent;
    }
    return false;
  }

  public boolean isScoped() {
    return scoped;
  }

  /**
   * @return nesting depth, 0 for the outermost scope
   */
  public int getDepth() {
    return depth;
  }

  /**
   * @return sorted list of all names visible as secret from this scope
   */
  public List<String> visibleSecrets() {
    Set<String> all = new HashSet<String>();
    SecrecyContext curr = this;
    while (curr != null) {
      all.addAll(curr.secretVars);
      curr = curr.parent;
    }
    List<String> result = new ArrayList<String>(all);
    Collections.sort(result);
    return result;
  }

  @Override
  public String toString() {
    return (scoped ? "scoped" : "flat") + visibleSecrets();
  }
}

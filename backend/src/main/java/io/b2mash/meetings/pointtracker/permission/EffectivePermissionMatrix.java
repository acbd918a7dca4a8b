package io.b2mash.meetings.pointtracker.permission;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Component;

/**
 * Process-wide holder of the matrix every permission check reads. Readers never lock; a new matrix
 * is built elsewhere and published with a single reference swap, so a reader sees either the old
 * matrix or the new one in full.
 */
@Component
public class EffectivePermissionMatrix {

  private final AtomicReference<PermissionMatrix> current =
      new AtomicReference<>(PermissionMatrix.defaults());

  public Set<Role> resolve(PermissionAction action) {
    return current.get().allowedRoles(action);
  }

  public PermissionMatrix current() {
    return current.get();
  }

  public void replace(PermissionMatrix matrix) {
    current.set(Objects.requireNonNull(matrix, "matrix"));
  }
}

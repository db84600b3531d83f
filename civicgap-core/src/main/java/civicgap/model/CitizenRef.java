package civicgap.model;

import java.util.Objects;

/**
 * How a submission identifies its citizen.
 *
 * <ul>
 *   <li>{@link ById}: an existing row id. Must resolve; never creates a citizen.</li>
 *   <li>{@link ByToken}: an opaque hashed identity token. Resolved get-or-create.</li>
 * </ul>
 */
public sealed interface CitizenRef permits CitizenRef.ById, CitizenRef.ByToken {

  static ById id(long id) {
    return new ById(id);
  }

  static ByToken token(String token) {
    return new ByToken(token);
  }

  record ById(long id) implements CitizenRef {
    @Override
    public String toString() {
      return "id:" + id;
    }
  }

  record ByToken(String token) implements CitizenRef {
    public ByToken {
      Objects.requireNonNull(token, "token");
    }

    // never print the token itself
    @Override
    public String toString() {
      return "token:" + Integer.toHexString(token.hashCode());
    }
  }
}

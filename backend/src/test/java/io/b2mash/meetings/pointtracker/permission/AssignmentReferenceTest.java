package io.b2mash.meetings.pointtracker.permission;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import org.junit.jupiter.api.Test;

class AssignmentReferenceTest {

  @Test
  void parsesUserReference() {
    var id = UUID.randomUUID();
    var reference = AssignmentReference.parse("user:" + id);

    assertThat(reference.kind()).isEqualTo(AssignmentReference.Kind.USER);
    assertThat(reference.value()).isEqualTo(id.toString());
    assertThat(reference.refersToUser(id)).isTrue();
    assertThat(reference.refersToUser(UUID.randomUUID())).isFalse();
  }

  @Test
  void parsesAttendeeAndCompanyReferences() {
    assertThat(AssignmentReference.parse("attendee:42").kind())
        .isEqualTo(AssignmentReference.Kind.ATTENDEE);
    assertThat(AssignmentReference.parse("company:Acme Structures").value())
        .isEqualTo("Acme Structures");
  }

  @Test
  void untaggedText_isLegacy() {
    var reference = AssignmentReference.parse("Jane Doe <jane@acme.test>");

    assertThat(reference.kind()).isEqualTo(AssignmentReference.Kind.LEGACY);
    assertThat(reference.mentionsEmail("jane@acme.test")).isTrue();
    assertThat(reference.mentionsEmail("john@acme.test")).isFalse();
  }

  @Test
  void blankEmail_neverMatches() {
    var reference = AssignmentReference.parse("anyone");

    assertThat(reference.mentionsEmail("")).isFalse();
    assertThat(reference.mentionsEmail("  ")).isFalse();
    assertThat(reference.mentionsEmail(null)).isFalse();
  }

  @Test
  void blankReference_parsesToNull() {
    assertThat(AssignmentReference.parse(null)).isNull();
    assertThat(AssignmentReference.parse(" ")).isNull();
  }

  @Test
  void forUser_roundTripsThroughParse() {
    var id = UUID.randomUUID();
    assertThat(AssignmentReference.parse(AssignmentReference.forUser(id)).refersToUser(id))
        .isTrue();
  }
}

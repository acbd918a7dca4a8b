package io.b2mash.meetings.pointtracker.meeting;

import io.b2mash.meetings.pointtracker.exception.InvalidStateException;
import io.b2mash.meetings.pointtracker.exception.ResourceConflictException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "meetings")
public class Meeting implements PointContainer {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false)
  private UUID projectId;

  @Column(name = "title", nullable = false, length = 500)
  private String title;

  @Column(name = "meeting_date", nullable = false)
  private LocalDate meetingDate;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ContainerStatus status;

  @Column(name = "closed_at")
  private Instant closedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Meeting() {}

  public Meeting(UUID projectId, String title, LocalDate meetingDate) {
    this.projectId = projectId;
    this.title = title;
    this.meetingDate = meetingDate;
    this.status = ContainerStatus.SCHEDULED;
    this.createdAt = Instant.now();
  }

  /** Closes the meeting. A meeting that is already closed is a conflict, not a no-op. */
  @Override
  public void close(Instant when) {
    if (status == ContainerStatus.CLOSED) {
      throw new ResourceConflictException(
          "Meeting already closed", "Meeting " + id + " is already closed");
    }
    requireTransition(ContainerStatus.CLOSED, "close");
    this.status = ContainerStatus.CLOSED;
    this.closedAt = when;
  }

  @Override
  public void reopen() {
    requireTransition(ContainerStatus.SCHEDULED, "reopen");
    this.status = ContainerStatus.SCHEDULED;
    this.closedAt = null;
  }

  private void requireTransition(ContainerStatus target, String action) {
    if (!this.status.canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid meeting state", "Cannot " + action + " meeting in status " + this.status);
    }
  }

  @Override
  public String kind() {
    return "meeting";
  }

  @Override
  public UUID getId() {
    return id;
  }

  @Override
  public UUID getProjectId() {
    return projectId;
  }

  @Override
  public String getTitle() {
    return title;
  }

  public LocalDate getMeetingDate() {
    return meetingDate;
  }

  @Override
  public ContainerStatus getStatus() {
    return status;
  }

  @Override
  public Instant getClosedAt() {
    return closedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}

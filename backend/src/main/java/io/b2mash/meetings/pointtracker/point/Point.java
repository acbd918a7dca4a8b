package io.b2mash.meetings.pointtracker.point;

import io.b2mash.meetings.pointtracker.exception.InvalidStateException;
import io.b2mash.meetings.pointtracker.exception.InvariantViolationException;
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

/**
 * An action item. Belongs to exactly one meeting or exactly one series; every mutator that touches
 * the parent keeps that invariant.
 */
@Entity
@Table(name = "points")
public class Point {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "meeting_id")
  private UUID meetingId;

  @Column(name = "series_id")
  private UUID seriesId;

  @Column(name = "title", nullable = false, length = 500)
  private String title;

  @Column(name = "assigned_to")
  private String assignedTo;

  @Column(name = "assigned_to_ref")
  private String assignedToRef;

  @Column(name = "due_date")
  private LocalDate dueDate;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private PointStatus status;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Point() {}

  private Point(UUID meetingId, UUID seriesId, String title, PointStatus status) {
    this.meetingId = meetingId;
    this.seriesId = seriesId;
    this.title = title;
    this.status = status;
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
    requireSingleParent();
  }

  public static Point inMeeting(UUID meetingId, String title, PointStatus status) {
    return new Point(meetingId, null, title, status);
  }

  public static Point inSeries(UUID seriesId, String title, PointStatus status) {
    return new Point(null, seriesId, title, status);
  }

  /**
   * Assigns the point. {@code assignedTo} is the display name, {@code assignedToRef} the tagged
   * reference permission checks read.
   */
  public void assign(String assignedTo, String assignedToRef, LocalDate dueDate) {
    this.assignedTo = assignedTo;
    this.assignedToRef = assignedToRef;
    this.dueDate = dueDate;
    this.updatedAt = Instant.now();
  }

  public void moveToMeeting(UUID targetMeetingId) {
    this.meetingId = targetMeetingId;
    this.seriesId = null;
    this.updatedAt = Instant.now();
    requireSingleParent();
  }

  public void moveToSeries(UUID targetSeriesId) {
    this.seriesId = targetSeriesId;
    this.meetingId = null;
    this.updatedAt = Instant.now();
    requireSingleParent();
  }

  /** Closes the point as part of closing its container. */
  public void forceClose() {
    this.status = PointStatus.CLOSED;
    this.updatedAt = Instant.now();
  }

  public void changeStatus(PointStatus newStatus) {
    if (newStatus == this.status) {
      throw new InvalidStateException(
          "Invalid point state", "Point " + id + " is already in status " + newStatus);
    }
    this.status = newStatus;
    this.updatedAt = Instant.now();
  }

  private void requireSingleParent() {
    if ((meetingId == null) == (seriesId == null)) {
      throw new InvariantViolationException(
          "Point must belong to exactly one meeting or series (meeting="
              + meetingId
              + ", series="
              + seriesId
              + ")");
    }
  }

  public boolean isUnresolved() {
    return status.isUnresolved();
  }

  public UUID getId() {
    return id;
  }

  public UUID getMeetingId() {
    return meetingId;
  }

  public UUID getSeriesId() {
    return seriesId;
  }

  public String getTitle() {
    return title;
  }

  public String getAssignedTo() {
    return assignedTo;
  }

  public String getAssignedToRef() {
    return assignedToRef;
  }

  public LocalDate getDueDate() {
    return dueDate;
  }

  public PointStatus getStatus() {
    return status;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}

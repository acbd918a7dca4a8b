package io.b2mash.meetings.pointtracker.point;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PointRepository extends JpaRepository<Point, UUID> {

  List<Point> findByMeetingIdAndStatusInOrderByCreatedAtAsc(
      UUID meetingId, Collection<PointStatus> statuses);

  List<Point> findBySeriesIdAndStatusInOrderByCreatedAtAsc(
      UUID seriesId, Collection<PointStatus> statuses);

  List<Point> findByMeetingIdOrderByCreatedAtAsc(UUID meetingId);

  List<Point> findBySeriesIdOrderByCreatedAtAsc(UUID seriesId);
}

package org.example.course.repository;

import org.example.course.entity.CourseEntity;
import org.example.course.entity.CourseStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CourseRepository extends JpaRepository<CourseEntity, String> {

    List<CourseEntity> findByUserIdAndStatusNotOrderByLastAccessedAtDesc(String userId, CourseStatus excluded);

    long countByUserIdAndStatus(String userId, CourseStatus status);

    List<CourseEntity> findByStatus(CourseStatus status);
}

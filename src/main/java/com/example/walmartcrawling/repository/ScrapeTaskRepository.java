package com.example.walmartcrawling.repository;

import com.example.walmartcrawling.entity.ScrapeTask;
import com.example.walmartcrawling.entity.ScrapeTaskStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * ScrapeTask 엔티티를 위한 Spring Data JPA 레포지토리
 * 
 * 상태 변경은 모두 "현재 상태가 기대한 값일 때만" 적용되는 조건부 UPDATE로 수행됩니다.
 * 반환값(변경된 행 수)이 0이면 다른 작성자가 먼저 전이했거나 허용되지 않는 전이입니다.
 */
@Repository
public interface ScrapeTaskRepository extends JpaRepository<ScrapeTask, Long>, JpaSpecificationExecutor<ScrapeTask> {

    /**
     * 특정 상태의 작업 목록 조회 (기동 시 복구 처리에 사용)
     * 
     * @param statuses 조회할 상태 목록
     * @return 해당 상태의 작업 리스트
     */
    List<ScrapeTask> findByStatusIn(Collection<ScrapeTaskStatus> statuses);

    /**
     * 각 상태별 개수를 확인하는 메서드
     * 
     * 작업 현황 조회(/status API)에서 사용됩니다.
     */
    long countByStatus(ScrapeTaskStatus status);

    /**
     * 실행 시작: 허용된 출발 상태일 때만 RUNNING으로 변경하고 시작 시간을 기록
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ScrapeTask t set t.status = :to, t.startedAt = :now, t.updatedAt = :now "
            + "where t.id = :id and t.status in :from")
    int start(@Param("id") Long id,
              @Param("from") Collection<ScrapeTaskStatus> from,
              @Param("to") ScrapeTaskStatus to,
              @Param("now") LocalDateTime now);

    /**
     * 비종료 상태 간 전이 (RUNNING ↔ SUSPENDED)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ScrapeTask t set t.status = :to, t.updatedAt = :now "
            + "where t.id = :id and t.status in :from")
    int transition(@Param("id") Long id,
                   @Param("from") Collection<ScrapeTaskStatus> from,
                   @Param("to") ScrapeTaskStatus to,
                   @Param("now") LocalDateTime now);

    /**
     * 종료 상태로 전이하며 종료 시간과 에러 메시지(성공 시 null)를 기록
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ScrapeTask t set t.status = :to, t.error = :error, t.finishedAt = :now, t.updatedAt = :now "
            + "where t.id = :id and t.status in :from")
    int finish(@Param("id") Long id,
               @Param("from") Collection<ScrapeTaskStatus> from,
               @Param("to") ScrapeTaskStatus to,
               @Param("error") String error,
               @Param("now") LocalDateTime now);
}

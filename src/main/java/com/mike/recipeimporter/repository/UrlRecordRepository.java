package com.mike.recipeimporter.repository;

import com.mike.recipeimporter.entity.UrlRecord;
import com.mike.recipeimporter.entity.UrlStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface UrlRecordRepository extends JpaRepository<UrlRecord, String> {

    boolean existsByUrlAndStatusInAndReimportFalse(String url, Collection<UrlStatus> statuses);

    long countByStatusIn(Collection<UrlStatus> statuses);

    long countByStatus(UrlStatus status);

    List<UrlRecord> findByStatusOrderByDiscoveredAtDesc(UrlStatus status);

    List<UrlRecord> findByStatusOrderByDiscoveredAtDesc(UrlStatus status, Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update UrlRecord u set u.reimport = true " +
            "where lower(u.domain) like lower(concat('%', :domain, '%'))")
    int markForReimport(@Param("domain") String domain);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from UrlRecord u where lower(u.domain) like lower(concat('%', :domain, '%'))")
    int deleteByDomainLike(@Param("domain") String domain);

    @Query("select u.domain as domain, count(u) as imported from UrlRecord u " +
            "where u.status in :statuses group by u.domain order by count(u) desc")
    List<DomainCountView> countByDomain(@Param("statuses") Collection<UrlStatus> statuses, Pageable pageable);

    interface DomainCountView {
        String getDomain();

        Long getImported();
    }
}

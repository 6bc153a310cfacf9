package com.example.frontdesk.repository;

import com.example.frontdesk.domain.CallLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CallLogRepository extends JpaRepository<CallLog, Long> {

    List<CallLog> findAllByOrderByStartedAtDescIdDesc(Pageable pageable);
}

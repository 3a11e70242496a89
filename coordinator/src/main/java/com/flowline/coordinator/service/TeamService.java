package com.flowline.coordinator.service;

import com.flowline.coordinator.model.Team;
import com.flowline.coordinator.repository.TeamRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Resolves the team names used in API paths. */
@Service
public class TeamService {

    private final TeamRepository teamRepo;

    public TeamService(TeamRepository teamRepo) {
        this.teamRepo = teamRepo;
    }

    @Transactional(readOnly = true)
    public Team getByName(String teamName) {
        return teamRepo.findByName(teamName)
                .orElseThrow(() -> new TeamNotFoundException(teamName));
    }
}

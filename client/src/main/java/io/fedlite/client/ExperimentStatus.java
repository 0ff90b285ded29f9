package io.fedlite.client;

import io.fedlite.protocols.AggregatorProto.CollaboratorStatus;
import io.fedlite.protocols.AggregatorProto.GetExperimentStatusResponse;

import java.util.List;

/**
 * Decoded form of an experiment status response.
 */
public record ExperimentStatus(
        String experimentName,
        String state,
        int currentRound,
        int roundsToTrain,
        List<Collaborator> collaborators
) {

    public record Collaborator(String label, String commonName, boolean connected) {
    }

    public ExperimentStatus {
        collaborators = List.copyOf(collaborators);
    }

    static ExperimentStatus fromProto(GetExperimentStatusResponse response) {
        List<Collaborator> collaborators = response.getCollaboratorsList().stream()
                .map(ExperimentStatus::collaborator)
                .toList();
        return new ExperimentStatus(
                response.getExperimentName(),
                response.getState(),
                response.getCurrentRound(),
                response.getRoundsToTrain(),
                collaborators
        );
    }

    private static Collaborator collaborator(CollaboratorStatus c) {
        return new Collaborator(c.getLabel(), c.getCommonName(), c.getConnected());
    }
}

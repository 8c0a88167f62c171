package com.example.ticketassist.retrieval;

import java.util.List;
import java.util.TreeSet;

import org.springframework.ai.document.Document;
import org.springframework.stereotype.Component;

import com.example.ticketassist.config.RetrievalProperties;
import com.example.ticketassist.model.Scores;

/**
 * Grades one query's reranked results from their score distribution:
 * a confident, clearly separated top hit is {@code good}, a merely relevant top hit is
 * {@code partially_good}, anything else is {@code poor}.
 */
@Component
public class QualityEvaluator {

    private final double goodTopScore;
    private final double goodScoreGap;
    private final double partialTopScore;

    public QualityEvaluator(RetrievalProperties properties) {
        this.goodTopScore = properties.goodTopScore();
        this.goodScoreGap = properties.goodScoreGap();
        this.partialTopScore = properties.partialTopScore();
    }

    public QualityAssessment evaluate(RetrievalResult result) {
        return evaluate(result.scores(), result.documents());
    }

    /** {@code scores} must be sorted best first. */
    public QualityAssessment evaluate(List<Double> scores, List<Document> documents) {
        if (scores.isEmpty()) {
            return QualityAssessment.poor(QualityAssessment.NO_DOCUMENTS_RETRIEVED);
        }

        double sum = 0.0;
        for (double s : scores) {
            sum += s;
        }
        double avg = sum / scores.size();
        double top = scores.get(0);
        // a lone hit has nothing to separate from, so its gap is the score itself
        double gap = scores.size() > 1 ? top - scores.get(1) : top;

        RetrievalQuality quality;
        if (top > goodTopScore && gap > goodScoreGap) {
            quality = RetrievalQuality.GOOD;
        } else if (top > partialTopScore) {
            quality = RetrievalQuality.PARTIALLY_GOOD;
        } else {
            quality = RetrievalQuality.POOR;
        }

        var categories = new TreeSet<String>();
        for (Document doc : documents) {
            categories.add(DocumentMetadata.category(doc));
        }

        return new QualityAssessment(
            quality,
            Scores.round3(avg),
            Scores.round3(top),
            Scores.round3(gap),
            documents.size(),
            List.copyOf(categories),
            null);
    }
}

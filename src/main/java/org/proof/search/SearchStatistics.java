package org.proof.search;

/**
 * STATISTICHE DI RICERCA - Metriche raccolte durante l'esplorazione delle riscritture
 *
 * Raccoglie i contatori della ricerca in ampiezza (prova) e in profondità
 * (forme raggiungibili) e il tempo di esecuzione, per il report finale.
 *
 */
public class SearchStatistics {

    //region CONTATORI

    /**
     * Formule estratte dalla frontiera ed esaminate.
     */
    private int statesExplored = 0;

    /**
     * Formule nuove generate dalla chiusura e accodate.
     */
    private int statesGenerated = 0;

    /**
     * Formule scartate senza espansione perché oltre il limite di dimensione o profondità.
     */
    private int statesPruned = 0;

    /**
     * Massimo numero di passi raggiunto dalla formula iniziale.
     */
    private int maxDepthReached = 0;

    //endregion

    //region ESITO E TIMING

    /** La ricerca è stata interrotta dall'esterno */
    private boolean interrupted = false;

    /** La ricerca si è fermata per esaurimento del budget di stati */
    private boolean budgetExhausted = false;

    private long executionTimeMs = 0;
    private final long startTime;
    private boolean timerStopped = false;

    //endregion

    /**
     * Avvia immediatamente la misurazione del tempo di esecuzione.
     */
    public SearchStatistics() {
        this.startTime = System.currentTimeMillis();
    }

    //region INCREMENTO CONTATORI

    public void incrementStatesExplored() {
        statesExplored++;
    }

    public void incrementStatesGenerated() {
        statesGenerated++;
    }

    public void incrementStatesPruned() {
        statesPruned++;
    }

    public void updateDepth(int depth) {
        maxDepthReached = Math.max(maxDepthReached, depth);
    }

    public void markInterrupted() {
        interrupted = true;
    }

    public void markBudgetExhausted() {
        budgetExhausted = true;
    }

    /**
     * Ferma il timer. Chiamate successive non alterano il tempo misurato.
     */
    public void stopTimer() {
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    //endregion

    //region ACCESSO

    public int getStatesExplored() {
        return statesExplored;
    }

    public int getStatesGenerated() {
        return statesGenerated;
    }

    public int getStatesPruned() {
        return statesPruned;
    }

    public int getMaxDepthReached() {
        return maxDepthReached;
    }

    public boolean isInterrupted() {
        return interrupted;
    }

    public boolean isBudgetExhausted() {
        return budgetExhausted;
    }

    public long getExecutionTimeMs() {
        return timerStopped ? executionTimeMs : System.currentTimeMillis() - startTime;
    }

    //endregion

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Stati esplorati: ").append(statesExplored).append('\n');
        sb.append("Stati generati: ").append(statesGenerated).append('\n');
        sb.append("Stati scartati per limiti: ").append(statesPruned).append('\n');
        sb.append("Profondità massima raggiunta: ").append(maxDepthReached).append('\n');
        if (interrupted) {
            sb.append("Ricerca interrotta\n");
        }
        if (budgetExhausted) {
            sb.append("Budget di stati esaurito\n");
        }
        sb.append("Tempo impiegato: ").append(getExecutionTimeMs()).append(" ms");
        return sb.toString();
    }
}

package io.github.riemr.voucher.domain.model;

/**
 * Canonical column names shared by the personnel spreadsheets.
 */
public final class SourceColumns {
    public static final String MATRICULA = "MATRICULA";
    public static final String SINDICATO = "Sindicato";
    public static final String ADMISSAO = "Admissão";
    public static final String TITULO_DO_CARGO = "TITULO DO CARGO";
    public static final String DIAS_DE_FERIAS = "DIAS DE FÉRIAS";
    public static final String DATA_DEMISSAO = "DATA DEMISSÃO";
    public static final String COMUNICADO_DESLIGAMENTO = "COMUNICADO DE DESLIGAMENTO";

    /** Alias of the identifier used by the overseas assignment sheet. */
    public static final String CADASTRO = "Cadastro";

    private SourceColumns() {
    }
}

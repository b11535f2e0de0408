package org.tlc4pipe.loading;

import java.util.List;
import java.util.Optional;

/**
 * Paso de selección del constructor de paquetes: dado un anfitrión y los tipos que aún tienen
 * stock, elige el huésped a telescopar. Aislado para poder reemplazar la heurística voraz por
 * otra estrategia sin tocar el resto del pipeline.
 */
public interface GuestSelector {

    /**
     * @param host       tubo que recibe al huésped
     * @param candidates tipos con cantidad restante &gt; 0, ya ordenados por DE descendente
     * @param settings   parámetros de holgura y reglas de SDR
     * @return el huésped elegido, o vacío si ninguno califica
     */
    Optional<PipeType> select(PipeType host, List<PipeType> candidates, LoadingSettings settings);
}
